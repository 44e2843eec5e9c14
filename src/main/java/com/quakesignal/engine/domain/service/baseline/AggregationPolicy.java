package com.quakesignal.engine.domain.service.baseline;

public enum AggregationPolicy {
    MAX,
    WEIGHTED
}
