package com.quakesignal.engine.infra.disruptor.config;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.quakesignal.engine.domain.service.run.RunProperties;
import com.quakesignal.engine.infra.disruptor.event.PartitionWriteEvent;
import com.quakesignal.engine.infra.disruptor.event.PartitionWriteEventFactory;
import com.quakesignal.engine.infra.disruptor.handler.DisruptorExceptionHandler;
import com.quakesignal.engine.infra.disruptor.handler.PartitionWriteHandler;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class PartitionWriterConfig {

    private final PartitionWriteHandler partitionWriteHandler;
    private final RunProperties runProperties;
    private final MeterRegistry meterRegistry;
    private final Environment environment;

    private Disruptor<PartitionWriteEvent> writerDisruptor;

    @Bean
    public DisruptorExceptionHandler<PartitionWriteEvent> partitionWriteExceptionHandler() {
        return new DisruptorExceptionHandler<>("partition-writer", meterRegistry);
    }

    @Bean
    public Disruptor<PartitionWriteEvent> partitionWriteDisruptor(
            DisruptorExceptionHandler<PartitionWriteEvent> partitionWriteExceptionHandler) {
        int bufferSize = runProperties.getPartitionQueueCapacity();
        WaitStrategy waitStrategy = resolveWaitStrategy();

        writerDisruptor = new Disruptor<>(
                new PartitionWriteEventFactory(),
                bufferSize,
                namedThreadFactory("partition-writer"),
                ProducerType.MULTI,
                waitStrategy
        );

        writerDisruptor.setDefaultExceptionHandler(partitionWriteExceptionHandler);
        writerDisruptor.handleEventsWith(partitionWriteHandler);
        writerDisruptor.start();

        log.info("[Disruptor] 파티션 기록 파이프라인 기동: Quality workers → Writer | size={}, wait={}",
                bufferSize, waitStrategy.getClass().getSimpleName());

        return writerDisruptor;
    }

    @Bean
    public RingBuffer<PartitionWriteEvent> partitionWriteRingBuffer(Disruptor<PartitionWriteEvent> partitionWriteDisruptor) {
        return partitionWriteDisruptor.getRingBuffer();
    }

    @PreDestroy
    public void shutdown() {
        if (writerDisruptor != null) {
            log.info("[Disruptor] 파티션 기록 파이프라인 종료 시작...");
            writerDisruptor.shutdown();
            log.info("[Disruptor] 파티션 기록 파이프라인 종료 완료");
        }
    }

    private WaitStrategy resolveWaitStrategy() {
        for (String profile : environment.getActiveProfiles()) {
            if ("prod".equals(profile)) {
                log.info("[Disruptor] prod 프로파일 → YieldingWaitStrategy (저지연)");
                return new YieldingWaitStrategy();
            }
        }
        log.info("[Disruptor] dev/local 프로파일 → BlockingWaitStrategy (저CPU)");
        return new BlockingWaitStrategy();
    }

    private ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
