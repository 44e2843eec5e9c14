package com.quakesignal.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SourceType {

    GEOMAG("geomag"),
    AEF("aef"),
    SEISMIC("seismic"),
    VLF("vlf");

    private final String key;

    SourceType(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static SourceType fromKey(String value) {
        if (value == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        SourceType type = fromKeyOrNull(value);
        if (type == null) {
            throw new IllegalArgumentException("unknown source: " + value);
        }
        return type;
    }

    public static SourceType fromKeyOrNull(String value) {
        if (value == null) return null;
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SourceType type : values()) {
            if (type.key.equals(normalized)) {
                return type;
            }
        }
        return null;
    }

    public boolean isSpectralDestined() {
        return this == SEISMIC || this == VLF || this == AEF;
    }
}
