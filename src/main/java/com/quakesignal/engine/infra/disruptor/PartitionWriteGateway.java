package com.quakesignal.engine.infra.disruptor;

import com.lmax.disruptor.RingBuffer;
import com.quakesignal.engine.domain.model.CanonicalRecord;
import com.quakesignal.engine.domain.model.PartitionKey;
import com.quakesignal.engine.infra.disruptor.event.PartitionWriteEvent;
import com.quakesignal.engine.infra.disruptor.handler.DisruptorExceptionHandler;
import com.quakesignal.engine.infra.disruptor.handler.PartitionWriteHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.LockSupport;

@Slf4j
@Component
@RequiredArgsConstructor
public class PartitionWriteGateway {

    private static final long DRAIN_POLL_NANOS = 1_000_000L;

    private final RingBuffer<PartitionWriteEvent> partitionWriteRingBuffer;
    private final PartitionWriteHandler partitionWriteHandler;
    private final DisruptorExceptionHandler<PartitionWriteEvent> partitionWriteExceptionHandler;

    public void publish(PartitionKey key, List<CanonicalRecord> records, String paramsHash) {
        List<CanonicalRecord> snapshot = List.copyOf(records);
        long sequence = partitionWriteRingBuffer.next();
        try {
            PartitionWriteEvent event = partitionWriteRingBuffer.get(sequence);
            event.setPartitionKey(key);
            event.setRecords(snapshot);
            event.setParamsHash(paramsHash);
            event.setPublishNanoTime(System.nanoTime());
        } finally {
            partitionWriteRingBuffer.publish(sequence);
        }
    }

    public void awaitDrained(Duration timeout) throws TimeoutException {
        long target = partitionWriteRingBuffer.getCursor();
        long deadline = System.nanoTime() + timeout.toNanos();
        while (partitionWriteHandler.processedSequence() < target) {
            if (System.nanoTime() - deadline > 0) {
                throw new TimeoutException("partition writer did not drain within " + timeout
                        + " (cursor=" + target + ", processed=" + partitionWriteHandler.processedSequence() + ")");
            }
            if (Thread.currentThread().isInterrupted()) {
                throw new IllegalStateException("interrupted while waiting for partition writer");
            }
            LockSupport.parkNanos(DRAIN_POLL_NANOS);
        }
        log.debug("[Disruptor] 파티션 큐 비움 완료: seq={}", target);
    }

    public long failureCount() {
        return partitionWriteExceptionHandler.failureCount();
    }

    public int bufferSize() {
        return partitionWriteRingBuffer.getBufferSize();
    }
}
