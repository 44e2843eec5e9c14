package com.quakesignal.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StationMatch {

    EXACT,
    DOWNGRADE,
    UNMATCHED;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static StationMatch fromKey(String value) {
        if (value == null) return UNMATCHED;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNMATCHED;
        }
    }
}
