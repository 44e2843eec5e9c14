package com.quakesignal.engine.infra.store;

import com.quakesignal.engine.domain.model.CanonicalRecord;
import com.quakesignal.engine.domain.model.PartitionKey;
import com.quakesignal.engine.domain.model.SourceType;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

public interface StandardizedStore {

    Comparator<CanonicalRecord> RECORD_ORDER = Comparator
            .comparingLong(CanonicalRecord::getTsMs)
            .thenComparing(CanonicalRecord::getChannel);

    void writePartition(PartitionKey key, List<CanonicalRecord> records);

    List<CanonicalRecord> query(SourceType source, String stationId, long fromMs, long toMs);

    Set<PartitionKey> partitions();

    Set<String> stations(SourceType source);

    long rowCount(PartitionKey key);

    default boolean isDurable() {
        return false;
    }
}
