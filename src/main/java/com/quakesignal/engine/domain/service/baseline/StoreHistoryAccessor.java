package com.quakesignal.engine.domain.service.baseline;

import com.quakesignal.engine.domain.model.CanonicalRecord;
import com.quakesignal.engine.domain.model.SeriesKey;
import com.quakesignal.engine.domain.model.SourceType;
import com.quakesignal.engine.domain.model.WaveformMetric;
import com.quakesignal.engine.domain.service.align.AlignProperties;
import com.quakesignal.engine.domain.service.feature.WaveformWindowReducer;
import com.quakesignal.engine.domain.service.signal.SamplingIntervals;
import com.quakesignal.engine.infra.store.StandardizedStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class StoreHistoryAccessor implements HistoryAccessor {

    private final StandardizedStore store;
    private final WaveformWindowReducer reducer;
    private final AlignProperties alignProperties;

    @Override
    public List<CanonicalRecord> fetch(SeriesKey key, long fromMs, long toMs) {
        if (toMs < fromMs) return List.of();

        List<CanonicalRecord> stored = channelRecords(key.source(), key.stationId(), key.channel(), fromMs, toMs);
        WaveformMetric metric = WaveformMetric.ofChannel(key.channel());
        if (!stored.isEmpty() || metric == null || key.source() != SourceType.SEISMIC) {
            return onGridStep(stored, alignProperties.gridStepMs());
        }

        String rawChannel = key.channel().substring(0, key.channel().lastIndexOf('.'));
        long windowMs = alignProperties.gridStepMs();
        List<CanonicalRecord> raw = channelRecords(key.source(), key.stationId(), rawChannel,
                fromMs, saturatedAdd(toMs, windowMs));
        return reducer.reduce(raw, windowMs).stream()
                .filter(r -> r.getChannel().equals(key.channel()))
                .filter(r -> r.getTsMs() >= fromMs && r.getTsMs() <= toMs)
                .collect(Collectors.toList());
    }

    static List<CanonicalRecord> onGridStep(List<CanonicalRecord> records, long stepMs) {
        if (records.size() < 2) return records;
        List<CanonicalRecord> ordered = new ArrayList<>(records);
        ordered.sort(Comparator.comparingLong(CanonicalRecord::getTsMs));
        long nativeInterval = SamplingIntervals.medianIntervalMs(
                ordered.stream().mapToLong(CanonicalRecord::getTsMs).toArray());
        if (nativeInterval <= 0 || nativeInterval >= stepMs) return ordered;

        SortedMap<Long, List<CanonicalRecord>> buckets = new TreeMap<>();
        for (CanonicalRecord record : ordered) {
            if (!record.hasFiniteValue()) continue;
            buckets.computeIfAbsent(Math.floorDiv(record.getTsMs(), stepMs) * stepMs, k -> new ArrayList<>())
                    .add(record);
        }
        List<CanonicalRecord> out = new ArrayList<>(buckets.size());
        buckets.forEach((bucketTs, bucket) -> {
            double sum = 0.0;
            for (CanonicalRecord record : bucket) {
                sum += record.getValue();
            }
            out.add(bucket.get(0).toBuilder()
                    .tsMs(bucketTs)
                    .value(sum / bucket.size())
                    .build());
        });
        return out;
    }

    private List<CanonicalRecord> channelRecords(SourceType source, String stationId, String channel,
                                                 long fromMs, long toMs) {
        return store.query(source, stationId, fromMs, toMs).stream()
                .filter(r -> channel.equals(r.getChannel()))
                .collect(Collectors.toList());
    }

    private static long saturatedAdd(long a, long b) {
        long sum = a + b;
        return ((a ^ sum) & (b ^ sum)) < 0 ? Long.MAX_VALUE : sum;
    }
}
