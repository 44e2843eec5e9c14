package com.quakesignal.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BaselineMethod {

    PRIMARY("primary"),
    SAME_HOUR_HISTORY("same-hour-history"),
    GLOBAL_QUANTILE("global-quantile");

    private final String key;

    BaselineMethod(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }
}
