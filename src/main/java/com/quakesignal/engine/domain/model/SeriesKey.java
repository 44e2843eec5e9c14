package com.quakesignal.engine.domain.model;

import java.util.Comparator;

public record SeriesKey(SourceType source, String stationId, String channel) implements Comparable<SeriesKey> {

    private static final Comparator<SeriesKey> ORDER = Comparator
            .comparing(SeriesKey::stationId)
            .thenComparing(SeriesKey::source)
            .thenComparing(SeriesKey::channel);

    public SeriesKey {
        if (source == null || stationId == null || channel == null) {
            throw new IllegalArgumentException("series key parts must not be null");
        }
    }

    @Override
    public int compareTo(SeriesKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return source.key() + ":" + stationId + ":" + channel;
    }
}
