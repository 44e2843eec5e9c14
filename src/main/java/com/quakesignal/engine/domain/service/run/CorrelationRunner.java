package com.quakesignal.engine.domain.service.run;

import com.quakesignal.engine.domain.model.EventRunResult;
import com.quakesignal.engine.domain.model.RunReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "run", name = "enabled", havingValue = "true")
public class CorrelationRunner implements ApplicationRunner {

    private final CorrelationRunService runService;

    @Override
    public void run(ApplicationArguments args) {
        log.info("[Run] 배치 실행 요청 수신");
        RunReport report = runService.runConfigured();
        long failed = report.eventsWithStatus(EventRunResult.Status.FAILED);
        if (failed > 0) {
            log.warn("[Run] 실패한 이벤트 {}건, reports/dq_linked.json 확인 필요", failed);
        }
    }
}
