package com.quakesignal.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum LinkState {

    PENDING,
    SPATIAL_RESOLVED,
    TIME_WINDOWED,
    ALIGNED,
    SUMMARIZED,
    DONE;

    public LinkState next() {
        return switch (this) {
            case PENDING -> SPATIAL_RESOLVED;
            case SPATIAL_RESOLVED -> TIME_WINDOWED;
            case TIME_WINDOWED -> ALIGNED;
            case ALIGNED -> SUMMARIZED;
            case SUMMARIZED, DONE -> DONE;
        };
    }

    public boolean isTerminal() {
        return this == DONE;
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
