package com.quakesignal.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@JsonPropertyOrder({"station_id", "source", "feature_name", "method", "degraded", "reason",
        "sample_count", "from_ms", "to_ms", "median", "mean", "scale"})
public class BaselineWindow {

    private final String stationId;
    private final SourceType source;
    private final String featureName;
    @JsonIgnore
    private final double[] samples;
    private final BaselineMethod method;
    private final boolean degraded;
    private final String reason;
    private final Long fromMs;
    private final Long toMs;
    private final double median;
    private final double mean;
    private final double scale;

    public int getSampleCount() {
        return samples == null ? 0 : samples.length;
    }

    @JsonIgnore
    public boolean isUsable() {
        return getSampleCount() > 0 && Double.isFinite(median) && Double.isFinite(mean);
    }
}
