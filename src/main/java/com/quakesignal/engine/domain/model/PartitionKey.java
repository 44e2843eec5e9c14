package com.quakesignal.engine.domain.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Comparator;

public record PartitionKey(SourceType source, String stationId, LocalDate date) implements Comparable<PartitionKey> {

    private static final Comparator<PartitionKey> ORDER = Comparator
            .comparing(PartitionKey::source)
            .thenComparing(PartitionKey::stationId)
            .thenComparing(PartitionKey::date);

    public PartitionKey {
        if (source == null || stationId == null || date == null) {
            throw new IllegalArgumentException("partition key parts must not be null");
        }
    }

    public static PartitionKey of(CanonicalRecord record) {
        return new PartitionKey(record.getSource(), record.getStationId(), utcDate(record.getTsMs()));
    }

    public static LocalDate utcDate(long tsMs) {
        return Instant.ofEpochMilli(tsMs).atZone(ZoneOffset.UTC).toLocalDate();
    }

    public long startMs() {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    }

    public long endMsExclusive() {
        return date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    }

    public String asPath() {
        return source.key() + "/" + stationId + "/" + date;
    }

    @Override
    public int compareTo(PartitionKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return asPath();
    }
}
