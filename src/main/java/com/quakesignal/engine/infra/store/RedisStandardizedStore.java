package com.quakesignal.engine.infra.store;

import com.quakesignal.engine.domain.model.CanonicalRecord;
import com.quakesignal.engine.domain.model.PartitionKey;
import com.quakesignal.engine.domain.model.SourceType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.DefaultTypedTuple;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "storage", name = "type", havingValue = "redis")
public class RedisStandardizedStore implements StandardizedStore {

    static final String PARTITION_KEY = "std:rows:";
    static final String DATES_KEY = "std:dates:";
    static final String STATIONS_KEY = "std:stations:";
    static final String PARTITIONS_SET_KEY = "std:partitions";

    private final RedisTemplate<String, Object> redisTemplate;

    @Override
    @SuppressWarnings("unchecked")
    public void writePartition(PartitionKey key, List<CanonicalRecord> records) {
        for (CanonicalRecord record : records) {
            if (!key.equals(PartitionKey.of(record))) {
                throw new IllegalArgumentException("record " + record + " does not belong to partition " + key);
            }
        }
        String rowsKey = rowsKey(key);
        Set<ZSetOperations.TypedTuple<Object>> tuples = new LinkedHashSet<>();
        for (CanonicalRecord record : records) {
            tuples.add(new DefaultTypedTuple<>(record, (double) record.getTsMs()));
        }

        redisTemplate.execute(new SessionCallback<List<Object>>() {
            @Override
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) {
                var ops = (RedisOperations<String, Object>) operations;
                ops.multi();
                ops.delete(rowsKey);
                if (!tuples.isEmpty()) {
                    ops.opsForZSet().add(rowsKey, tuples);
                }
                ops.opsForSet().add(datesKey(key.source(), key.stationId()), key.date().toString());
                ops.opsForSet().add(STATIONS_KEY + key.source().key(), key.stationId());
                ops.opsForSet().add(PARTITIONS_SET_KEY, key.asPath());
                return ops.exec();
            }
        });
        log.debug("[Store] Redis 파티션 기록: partition={}, rows={}", key, records.size());
    }

    @Override
    public List<CanonicalRecord> query(SourceType source, String stationId, long fromMs, long toMs) {
        if (toMs < fromMs) return List.of();
        LocalDate first = PartitionKey.utcDate(Math.max(fromMs, 0L));
        LocalDate last = PartitionKey.utcDate(Math.max(toMs, 0L));

        List<CanonicalRecord> out = new ArrayList<>();
        for (LocalDate date : storedDates(source, stationId)) {
            if (date.isBefore(first) || date.isAfter(last)) continue;
            String key = rowsKey(new PartitionKey(source, stationId, date));
            Set<Object> members = redisTemplate.opsForZSet().rangeByScore(key, fromMs, toMs);
            if (members == null) continue;
            members.stream()
                    .filter(CanonicalRecord.class::isInstance)
                    .map(CanonicalRecord.class::cast)
                    .forEach(out::add);
        }
        out.sort(RECORD_ORDER);
        return out;
    }

    @Override
    public Set<PartitionKey> partitions() {
        Set<Object> members = redisTemplate.opsForSet().members(PARTITIONS_SET_KEY);
        if (members == null || members.isEmpty()) return Collections.emptySet();
        Set<PartitionKey> keys = new TreeSet<>();
        for (Object member : members) {
            String[] parts = String.valueOf(member).split("/", 3);
            if (parts.length == 3) {
                keys.add(new PartitionKey(SourceType.fromKey(parts[0]), parts[1], LocalDate.parse(parts[2])));
            }
        }
        return keys;
    }

    @Override
    public Set<String> stations(SourceType source) {
        Set<Object> members = redisTemplate.opsForSet().members(STATIONS_KEY + source.key());
        if (members == null) return Collections.emptySet();
        Set<String> stations = new TreeSet<>();
        members.forEach(m -> stations.add(String.valueOf(m)));
        return stations;
    }

    @Override
    public long rowCount(PartitionKey key) {
        Long count = redisTemplate.opsForZSet().zCard(rowsKey(key));
        return count != null ? count : 0L;
    }

    private TreeSet<LocalDate> storedDates(SourceType source, String stationId) {
        Set<Object> members = redisTemplate.opsForSet().members(datesKey(source, stationId));
        TreeSet<LocalDate> dates = new TreeSet<>();
        if (members != null) {
            members.forEach(m -> dates.add(LocalDate.parse(String.valueOf(m))));
        }
        return dates;
    }

    static String rowsKey(PartitionKey key) {
        return PARTITION_KEY + key.source().key() + ":" + key.stationId() + ":" + key.date();
    }

    static String datesKey(SourceType source, String stationId) {
        return DATES_KEY + source.key() + ":" + stationId;
    }

    @Override
    public boolean isDurable() {
        return true;
    }
}
