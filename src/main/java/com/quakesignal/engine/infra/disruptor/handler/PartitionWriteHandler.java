package com.quakesignal.engine.infra.disruptor.handler;

import com.lmax.disruptor.EventHandler;
import com.quakesignal.engine.domain.model.PartitionKey;
import com.quakesignal.engine.domain.model.UnitType;
import com.quakesignal.engine.domain.service.run.RunManifestService;
import com.quakesignal.engine.infra.disruptor.event.PartitionWriteEvent;
import com.quakesignal.engine.infra.store.StandardizedStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Component
@RequiredArgsConstructor
public class PartitionWriteHandler implements EventHandler<PartitionWriteEvent> {

    private final StandardizedStore store;
    private final RunManifestService manifest;
    private final MeterRegistry meterRegistry;

    private final AtomicLong processedSequence = new AtomicLong(-1L);

    private Counter partitionsWritten;
    private Counter rowsWritten;
    private Timer queueLatency;

    @PostConstruct
    public void initMetrics() {
        partitionsWritten = Counter.builder("engine.partitions.written")
                .description("Standardized partitions written to the store")
                .register(meterRegistry);
        rowsWritten = Counter.builder("engine.rows.written")
                .description("Standardized rows written to the store")
                .register(meterRegistry);
        queueLatency = Timer.builder("disruptor.partition.queue_latency")
                .description("Time from publish to partition write completion")
                .register(meterRegistry);
    }

    @Override
    public void onEvent(PartitionWriteEvent event, long sequence, boolean endOfBatch) {
        try {
            PartitionKey key = event.getPartitionKey();
            if (key == null || event.getRecords() == null) return;

            store.writePartition(key, event.getRecords());
            if (event.getParamsHash() != null) {
                manifest.markComplete(UnitType.PARTITION, key.asPath(), event.getParamsHash(), event.getRecords().size());
            }
            partitionsWritten.increment();
            rowsWritten.increment(event.getRecords().size());
            queueLatency.record(System.nanoTime() - event.getPublishNanoTime(), TimeUnit.NANOSECONDS);

            if (endOfBatch) {
                log.debug("[Disruptor] 파티션 배치 기록 완료: seq={}, last={}", sequence, key);
            }
        } finally {
            event.clear();
            processedSequence.set(sequence);
        }
    }

    public long processedSequence() {
        return processedSequence.get();
    }
}
