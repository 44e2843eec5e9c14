package com.quakesignal.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@JsonPropertyOrder({"event_id", "station_id", "source", "feature_name", "value", "nan_ratio"})
public class Feature {

    private final String eventId;
    private final String stationId;
    private final SourceType source;
    private final String featureName;
    private final double value;
    private final double nanRatio;
}
