package com.quakesignal.engine.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Getter
@Builder
public class FeatureSet {

    private final String eventId;
    private final String stationId;
    private final SourceType source;
    private final List<Feature> features;
    private final double missingRate;

    public Map<String, Double> asMap() {
        Map<String, Double> map = new TreeMap<>();
        for (Feature f : features) {
            map.put(f.getFeatureName(), f.getValue());
        }
        return map;
    }
}
