package com.quakesignal.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AlignMethod {

    AGGREGATE,
    REINDEX;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
