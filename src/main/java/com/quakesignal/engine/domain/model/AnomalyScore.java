package com.quakesignal.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@JsonPropertyOrder({"event_id", "station_id", "source", "feature_name", "ts_ms", "value", "score", "raw_z",
        "is_anomaly", "baseline_method", "degraded", "params_hash"})
public class AnomalyScore {

    private final String eventId;
    private final String stationId;
    private final SourceType source;
    private final String featureName;
    private final long tsMs;
    private final Double value;
    private final Double score;
    private final Double rawZ;
    @JsonProperty("is_anomaly")
    private final boolean anomaly;
    private final BaselineMethod baselineMethod;
    private final boolean degraded;
    private final String paramsHash;
}
