package com.quakesignal.engine.infra.disruptor.handler;

import com.lmax.disruptor.ExceptionHandler;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicLong;

@Slf4j
public class DisruptorExceptionHandler<T> implements ExceptionHandler<T> {

    private final String pipelineName;
    private final Counter exceptionCounter;
    private final AtomicLong failures = new AtomicLong();

    public DisruptorExceptionHandler(String pipelineName, MeterRegistry meterRegistry) {
        this.pipelineName = pipelineName;
        this.exceptionCounter = Counter.builder("disruptor.exceptions")
                .tag("pipeline", pipelineName)
                .description("Partition writer exception count")
                .register(meterRegistry);
    }

    public long failureCount() {
        return failures.get();
    }

    @Override
    public void handleEventException(Throwable ex, long sequence, T event) {
        exceptionCounter.increment();
        failures.incrementAndGet();
        log.error("[Disruptor-{}] 파티션 기록 실패 (seq={}, event={}). 매니페스트 미기록, 다음 실행에서 재처리.",
                pipelineName, sequence, event, ex);
    }

    @Override
    public void handleOnStartException(Throwable ex) {
        log.error("[Disruptor-{}] 핸들러 시작 예외", pipelineName, ex);
    }

    @Override
    public void handleOnShutdownException(Throwable ex) {
        log.error("[Disruptor-{}] 핸들러 종료 예외", pipelineName, ex);
    }
}
