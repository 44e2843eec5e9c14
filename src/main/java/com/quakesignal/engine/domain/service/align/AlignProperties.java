package com.quakesignal.engine.domain.service.align;

import com.quakesignal.engine.domain.exception.InvalidConfigurationException;
import com.quakesignal.engine.domain.model.SourceType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "align")
public class AlignProperties {

    private Duration gridStep = Duration.ofMinutes(1);
    private long reindexToleranceMs = 0;
    private long rawWaveformIntervalMs = 1000;
    private Map<String, Policy> policies = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Policy {
        private boolean forwardFill = false;
        private int forwardFillLimit = 1;
    }

    public long gridStepMs() {
        return gridStep.toMillis();
    }

    public SourcePolicy policyFor(SourceType source) {
        Policy policy = policies.get(source.key());
        if (policy == null) {
            return new SourcePolicy(source, false, 0, reindexToleranceMs, rawWaveformIntervalMs);
        }
        return new SourcePolicy(source, policy.isForwardFill(), policy.getForwardFillLimit(),
                reindexToleranceMs, rawWaveformIntervalMs);
    }

    public void validate() {
        if (gridStep == null || gridStep.toMillis() <= 0) {
            throw new InvalidConfigurationException("align.grid-step must be positive: " + gridStep);
        }
        if (reindexToleranceMs < 0 || reindexToleranceMs * 2 >= gridStep.toMillis()) {
            throw new InvalidConfigurationException("align.reindex-tolerance-ms must be in [0, grid-step/2)");
        }
        for (Map.Entry<String, Policy> entry : policies.entrySet()) {
            SourceType source = SourceType.fromKeyOrNull(entry.getKey());
            if (source == null) {
                throw new InvalidConfigurationException("align.policies has unknown source: " + entry.getKey());
            }
            Policy policy = entry.getValue();
            if (policy.isForwardFill() && source.isSpectralDestined()) {
                throw new InvalidConfigurationException(
                        "forward fill is not allowed for spectral source: " + source.key());
            }
            if (policy.isForwardFill() && policy.getForwardFillLimit() < 1) {
                throw new InvalidConfigurationException("align.policies." + source.key() + ".forward-fill-limit must be >= 1");
            }
        }
    }
}
