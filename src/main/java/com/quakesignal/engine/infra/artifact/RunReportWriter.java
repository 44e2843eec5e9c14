package com.quakesignal.engine.infra.artifact;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Slf4j
@Component
public class RunReportWriter {

    public static final String DQ_RAW_BRONZE = "dq_raw_bronze.json";
    public static final String DQ_STANDARD = "dq_standard.json";
    public static final String DQ_LINKED = "dq_linked.json";
    public static final String DQ_FEATURES = "dq_features.json";
    public static final String FILTER_EFFECT = "filter_effect.json";
    public static final String CONFIG_SNAPSHOT = "config_snapshot.json";

    private final AtomicJsonWriter writer = new AtomicJsonWriter(ArtifactJson.mapper());

    public Path write(Path outputDir, String fileName, Object report) {
        Path target = outputDir.resolve("reports").resolve(fileName);
        writer.write(target, report);
        log.info("[Artifact] 리포트 기록: {}", target);
        return target;
    }
}
