package com.quakesignal.engine.domain.service.quality;

import com.quakesignal.engine.domain.model.CanonicalRecord;
import com.quakesignal.engine.domain.model.MissingReason;
import com.quakesignal.engine.domain.model.QualityFlags;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

@Slf4j
@Component
@RequiredArgsConstructor
public class SentinelFilter {

    static final long MIN_VALID_TS_MS = 0L;
    static final long MAX_VALID_TS_MS = 4_102_444_800_000L;
    private static final double SENTINEL_TOLERANCE = 1e-9;

    private final QualityProperties properties;

    public Result apply(List<CanonicalRecord> input) {
        TreeMap<Long, CanonicalRecord> byTimestamp = new TreeMap<>();
        int dropped = 0;
        int duplicates = 0;
        boolean reordered = false;
        long previousTs = Long.MIN_VALUE;

        for (CanonicalRecord record : input) {
            if (record == null || !isWellFormed(record)) {
                dropped++;
                continue;
            }
            long ts = record.getTsMs();
            if (ts < previousTs) {
                reordered = true;
            }
            previousTs = Math.max(previousTs, ts);
            if (byTimestamp.put(ts, classify(record)) != null) {
                duplicates++;
            }
        }

        List<CanonicalRecord> records = new ArrayList<>(byTimestamp.values());
        int sentinels = 0;
        int parseErrors = 0;
        for (CanonicalRecord record : records) {
            MissingReason reason = record.getQualityFlags().getMissingReason();
            if (reason == MissingReason.SENTINEL) sentinels++;
            if (reason == MissingReason.PARSE_ERROR) parseErrors++;
        }

        if (dropped > 0 || duplicates > 0) {
            log.debug("[Quality] 정제: dropped={}, duplicates={}, reordered={}", dropped, duplicates, reordered);
        }
        return new Result(records, dropped, parseErrors, duplicates, reordered, sentinels);
    }

    public boolean isSentinel(double value) {
        if (!Double.isFinite(value)) return false;
        if (Math.abs(value) >= properties.getSentinelFloor()) return true;
        for (Double sentinel : properties.getSentinelValues()) {
            if (sentinel != null && Math.abs(value - sentinel) <= SENTINEL_TOLERANCE) {
                return true;
            }
        }
        return false;
    }

    private boolean isWellFormed(CanonicalRecord record) {
        return record.getSource() != null
                && record.getStationId() != null && !record.getStationId().isBlank()
                && record.getChannel() != null && !record.getChannel().isBlank()
                && record.getTsMs() >= MIN_VALID_TS_MS
                && record.getTsMs() < MAX_VALID_TS_MS;
    }

    private CanonicalRecord classify(CanonicalRecord record) {
        QualityFlags flags = record.getQualityFlags() != null ? record.getQualityFlags() : QualityFlags.ok();
        double value = record.getValue();

        if (flags.getMissingReason() == MissingReason.PARSE_ERROR || Double.isInfinite(value)) {
            return record.withValue(Double.NaN, QualityFlags.missing(MissingReason.PARSE_ERROR));
        }
        if (isSentinel(value)) {
            return record.withValue(Double.NaN, QualityFlags.missing(MissingReason.SENTINEL));
        }
        if (Double.isNaN(value) || flags.isMissing()) {
            MissingReason reason = flags.getMissingReason() != null ? flags.getMissingReason() : MissingReason.UNKNOWN;
            return record.withValue(Double.NaN, QualityFlags.missing(reason));
        }
        return record.getQualityFlags() == flags ? record : record.withValue(value, flags);
    }

    public record Result(List<CanonicalRecord> records,
                         int droppedParseErrors,
                         int parseErrorPoints,
                         int duplicatesCollapsed,
                         boolean reordered,
                         int sentinelCount) {
    }
}
