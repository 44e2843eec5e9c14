package com.quakesignal.engine.infra.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.quakesignal.engine.domain.model.CanonicalRecord;
import com.quakesignal.engine.domain.model.PartitionKey;
import com.quakesignal.engine.domain.model.SourceType;
import com.quakesignal.engine.domain.model.UnitType;
import com.quakesignal.engine.domain.service.run.RunManifestService;
import com.quakesignal.engine.infra.disruptor.event.PartitionWriteEvent;
import com.quakesignal.engine.infra.disruptor.event.PartitionWriteEventFactory;
import com.quakesignal.engine.infra.disruptor.handler.DisruptorExceptionHandler;
import com.quakesignal.engine.infra.disruptor.handler.PartitionWriteHandler;
import com.quakesignal.engine.infra.store.InMemoryStandardizedStore;
import com.quakesignal.engine.infra.store.StandardizedStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.quakesignal.engine.support.Records.MINUTE_MS;
import static com.quakesignal.engine.support.Records.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class PartitionWriteGatewayTest {

    private static final long DAY_MS = 86_400_000L;
    private static final long T0 = 1_672_531_200_000L;

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final RunManifestService manifest = mock(RunManifestService.class);
    private Disruptor<PartitionWriteEvent> disruptor;

    @AfterEach
    void tearDown() {
        if (disruptor != null) {
            disruptor.halt();
        }
    }

    @Test
    void publishedPartitionsAreWrittenAndRecordedInManifestEvenWhenProducersOutrunTheBuffer() throws Exception {
        InMemoryStandardizedStore store = new InMemoryStandardizedStore();
        PartitionWriteGateway gateway = start(store, 8);

        for (int day = 0; day < 20; day++) {
            List<CanonicalRecord> records = series(SourceType.GEOMAG, "KAK", "X", T0 + day * DAY_MS, MINUTE_MS, 5, i -> i);
            gateway.publish(PartitionKey.of(records.get(0)), records, "hash-1");
        }
        gateway.awaitDrained(Duration.ofSeconds(10));

        assertThat(store.partitions()).hasSize(20);
        assertThat(store.rowCount(new PartitionKey(SourceType.GEOMAG, "KAK", LocalDate.of(2023, 1, 20)))).isEqualTo(5);
        assertThat(gateway.failureCount()).isZero();
        verify(manifest, times(20)).markComplete(eq(UnitType.PARTITION), anyString(), eq("hash-1"), eq(5L));
        assertThat(meterRegistry.get("engine.partitions.written").counter().count()).isEqualTo(20.0);
        assertThat(meterRegistry.get("engine.rows.written").counter().count()).isEqualTo(100.0);
    }

    @Test
    void failedWriteIsCountedAndLeavesManifestUntouched() throws Exception {
        StandardizedStore failing = mock(StandardizedStore.class);
        doThrow(new IllegalStateException("disk full"))
                .when(failing).writePartition(any(), anyList());
        PartitionWriteGateway gateway = start(failing, 4);

        List<CanonicalRecord> records = series(SourceType.AEF, "KAK", "E", T0, MINUTE_MS, 3, i -> 100.0);
        gateway.publish(PartitionKey.of(records.get(0)), records, "hash-1");
        gateway.awaitDrained(Duration.ofSeconds(10));

        assertThat(gateway.failureCount()).isEqualTo(1);
        verify(manifest, never()).markComplete(any(), anyString(), anyString(), anyLong());
        assertThat(meterRegistry.get("disruptor.exceptions").tag("pipeline", "partition-writer").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void drainTimesOutWhileTheWriterIsStuck() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        InMemoryStandardizedStore slow = new InMemoryStandardizedStore() {
            @Override
            public void writePartition(PartitionKey key, List<CanonicalRecord> records) {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                super.writePartition(key, records);
            }
        };
        PartitionWriteGateway gateway = start(slow, 4);
        List<CanonicalRecord> records = series(SourceType.VLF, "NWC", "amp", T0, MINUTE_MS, 2, i -> -40.0);

        gateway.publish(PartitionKey.of(records.get(0)), records, null);

        assertThatThrownBy(() -> gateway.awaitDrained(Duration.ofMillis(50)))
                .isInstanceOf(TimeoutException.class)
                .hasMessageContaining("did not drain");
        release.countDown();
        gateway.awaitDrained(Duration.ofSeconds(10));
        assertThat(slow.partitions()).hasSize(1);
        verify(manifest, never()).markComplete(any(), anyString(), anyString(), anyLong());
    }

    @Test
    void drainingAnIdleWriterReturnsImmediately() throws Exception {
        PartitionWriteGateway gateway = start(new InMemoryStandardizedStore(), 4);

        gateway.awaitDrained(Duration.ofMillis(1));

        assertThat(gateway.bufferSize()).isEqualTo(4);
    }

    private PartitionWriteGateway start(StandardizedStore store, int bufferSize) {
        PartitionWriteHandler handler = new PartitionWriteHandler(store, manifest, meterRegistry);
        handler.initMetrics();
        DisruptorExceptionHandler<PartitionWriteEvent> exceptionHandler =
                new DisruptorExceptionHandler<>("partition-writer", meterRegistry);

        disruptor = new Disruptor<>(new PartitionWriteEventFactory(), bufferSize, DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI, new BlockingWaitStrategy());
        disruptor.setDefaultExceptionHandler(exceptionHandler);
        disruptor.handleEventsWith(handler);
        disruptor.start();
        return new PartitionWriteGateway(disruptor.getRingBuffer(), handler, exceptionHandler);
    }
}
