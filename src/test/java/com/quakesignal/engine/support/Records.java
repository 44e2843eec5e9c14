package com.quakesignal.engine.support;

import com.quakesignal.engine.domain.model.CanonicalRecord;
import com.quakesignal.engine.domain.model.QualityFlags;
import com.quakesignal.engine.domain.model.SourceType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntToDoubleFunction;

public final class Records {

    public static final long MINUTE_MS = 60_000L;
    public static final long HOUR_MS = 3_600_000L;

    private Records() {
    }

    public static long at(String iso) {
        return Instant.parse(iso).toEpochMilli();
    }

    public static CanonicalRecord record(SourceType source, String station, String channel, long tsMs, double value) {
        return CanonicalRecord.builder()
                .tsMs(tsMs)
                .source(source)
                .stationId(station)
                .channel(channel)
                .value(value)
                .qualityFlags(QualityFlags.ok())
                .build();
    }

    public static CanonicalRecord located(SourceType source, String station, String channel, long tsMs, double value,
                                          double lat, double lon) {
        return record(source, station, channel, tsMs, value).toBuilder()
                .lat(lat)
                .lon(lon)
                .build();
    }

    public static List<CanonicalRecord> series(SourceType source, String station, String channel,
                                               long startMs, long stepMs, int count, IntToDoubleFunction value) {
        List<CanonicalRecord> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            out.add(record(source, station, channel, startMs + i * stepMs, value.applyAsDouble(i)));
        }
        return out;
    }
}
