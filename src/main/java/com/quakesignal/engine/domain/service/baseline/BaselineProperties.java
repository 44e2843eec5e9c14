package com.quakesignal.engine.domain.service.baseline;

import com.quakesignal.engine.domain.exception.InvalidConfigurationException;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "baseline")
public class BaselineProperties {

    private long extraHours = 168;
    private long gapHours = 6;
    private int minSamples = 500;
    private int historyDays = 365;
    private int featureMinWindows = 5;
    private int featureHistoryWindows = 28;
    private double steepness = 1.0;
    private double anomalyThreshold = 0.95;
    private boolean twoSided = true;
    private AggregationPolicy aggregation = AggregationPolicy.MAX;
    private Map<String, Double> weights = new LinkedHashMap<>();

    public double weightFor(String featureName, String sourceKey) {
        Double weight = weights.get(featureName);
        if (weight == null) weight = weights.get(sourceKey);
        return weight != null ? weight : 1.0;
    }

    public void validate() {
        if (extraHours < 0 || gapHours < 0) {
            throw new InvalidConfigurationException("baseline.extra-hours and baseline.gap-hours must not be negative");
        }
        if (minSamples < 1) {
            throw new InvalidConfigurationException("baseline.min-samples must be >= 1");
        }
        if (historyDays < 1) {
            throw new InvalidConfigurationException("baseline.history-days must be >= 1");
        }
        if (featureMinWindows < 1) {
            throw new InvalidConfigurationException("baseline.feature-min-windows must be >= 1");
        }
        if (featureHistoryWindows < featureMinWindows) {
            throw new InvalidConfigurationException("baseline.feature-history-windows must be >= baseline.feature-min-windows");
        }
        if (!(steepness > 0) || !Double.isFinite(steepness)) {
            throw new InvalidConfigurationException("baseline.steepness must be positive");
        }
        if (!(anomalyThreshold > 0.5 && anomalyThreshold < 1.0)) {
            throw new InvalidConfigurationException("baseline.anomaly-threshold must be within (0.5, 1): " + anomalyThreshold);
        }
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            if (entry.getValue() == null || entry.getValue() < 0 || !Double.isFinite(entry.getValue())) {
                throw new InvalidConfigurationException("baseline.weights." + entry.getKey() + " must be a non-negative number");
            }
        }
    }
}
