package com.quakesignal.engine.infra.disruptor.monitor;

import com.lmax.disruptor.RingBuffer;
import com.quakesignal.engine.infra.disruptor.event.PartitionWriteEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class DisruptorMetricsCollector {

    private final RingBuffer<PartitionWriteEvent> writerRingBuffer;
    private final MeterRegistry meterRegistry;

    public DisruptorMetricsCollector(RingBuffer<PartitionWriteEvent> partitionWriteRingBuffer,
                                     MeterRegistry meterRegistry) {
        this.writerRingBuffer = partitionWriteRingBuffer;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        Gauge.builder("disruptor.ringbuffer.utilization", writerRingBuffer,
                        rb -> 1.0 - ((double) rb.remainingCapacity() / rb.getBufferSize()))
                .tag("pipeline", "partition-writer")
                .description("Partition writer RingBuffer utilization (0.0~1.0)")
                .register(meterRegistry);

        Gauge.builder("disruptor.ringbuffer.remaining", writerRingBuffer,
                        rb -> (double) rb.remainingCapacity())
                .tag("pipeline", "partition-writer")
                .description("Partition writer RingBuffer remaining capacity")
                .register(meterRegistry);

        log.info("[Metrics] 파티션 기록 RingBuffer 모니터링 등록 완료");
    }

    @Scheduled(fixedRate = 30_000)
    public void logMetricsSummary() {
        long used = writerRingBuffer.getBufferSize() - writerRingBuffer.remainingCapacity();
        if (used == 0) return;

        double util = (double) used / writerRingBuffer.getBufferSize();
        Counter written = meterRegistry.find("engine.partitions.written").counter();
        Timer latency = meterRegistry.find("disruptor.partition.queue_latency").timer();

        log.info("[Metrics] Writer RB: {}% ({}/{}) | written={} | queue avg={}ms",
                String.format(Locale.ROOT, "%.1f", util * 100),
                used,
                writerRingBuffer.getBufferSize(),
                written != null ? (long) written.count() : 0L,
                latency != null ? String.format(Locale.ROOT, "%.1f", latency.mean(TimeUnit.MILLISECONDS)) : "N/A");
    }
}
