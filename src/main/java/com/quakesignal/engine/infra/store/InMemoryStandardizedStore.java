package com.quakesignal.engine.infra.store;

import com.quakesignal.engine.domain.model.CanonicalRecord;
import com.quakesignal.engine.domain.model.PartitionKey;
import com.quakesignal.engine.domain.model.SourceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "storage", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryStandardizedStore implements StandardizedStore {

    private final Map<PartitionKey, NavigableMap<Long, List<CanonicalRecord>>> partitions = new ConcurrentHashMap<>();

    @Override
    public void writePartition(PartitionKey key, List<CanonicalRecord> records) {
        NavigableMap<Long, List<CanonicalRecord>> byTs = new ConcurrentSkipListMap<>();
        for (CanonicalRecord record : records) {
            if (!key.equals(PartitionKey.of(record))) {
                throw new IllegalArgumentException("record " + record + " does not belong to partition " + key);
            }
            byTs.computeIfAbsent(record.getTsMs(), ts -> new ArrayList<>()).add(record);
        }
        byTs.replaceAll((ts, list) -> {
            list.sort(RECORD_ORDER);
            return Collections.unmodifiableList(list);
        });
        partitions.put(key, byTs);
        log.debug("[Store] 파티션 기록: partition={}, rows={}", key, records.size());
    }

    @Override
    public List<CanonicalRecord> query(SourceType source, String stationId, long fromMs, long toMs) {
        if (toMs < fromMs) return List.of();
        List<CanonicalRecord> out = new ArrayList<>();
        LocalDate first = firstDate(source, stationId, fromMs);
        LocalDate last = lastDate(source, stationId, toMs);
        if (first == null || last == null) return out;
        for (LocalDate date = first; !date.isAfter(last); date = date.plusDays(1)) {
            NavigableMap<Long, List<CanonicalRecord>> partition = partitions.get(new PartitionKey(source, stationId, date));
            if (partition == null) continue;
            partition.subMap(fromMs, true, toMs, true).values().forEach(out::addAll);
        }
        return out;
    }

    @Override
    public Set<PartitionKey> partitions() {
        return Collections.unmodifiableSet(new TreeSet<>(partitions.keySet()));
    }

    @Override
    public Set<String> stations(SourceType source) {
        return partitions.keySet().stream()
                .filter(key -> key.source() == source)
                .map(PartitionKey::stationId)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    @Override
    public long rowCount(PartitionKey key) {
        NavigableMap<Long, List<CanonicalRecord>> partition = partitions.get(key);
        if (partition == null) return 0L;
        return partition.values().stream().mapToLong(List::size).sum();
    }

    private LocalDate firstDate(SourceType source, String stationId, long fromMs) {
        LocalDate requested = PartitionKey.utcDate(Math.max(fromMs, 0L));
        return stationDates(source, stationId).ceiling(requested);
    }

    private LocalDate lastDate(SourceType source, String stationId, long toMs) {
        LocalDate requested = PartitionKey.utcDate(Math.max(toMs, 0L));
        return stationDates(source, stationId).floor(requested);
    }

    private TreeSet<LocalDate> stationDates(SourceType source, String stationId) {
        return partitions.keySet().stream()
                .filter(key -> key.source() == source && key.stationId().equals(stationId))
                .map(PartitionKey::date)
                .collect(Collectors.toCollection(TreeSet::new));
    }
}
