package com.quakesignal.engine.domain.service.quality;

import java.util.Locale;

public enum ImputeMethod {
    LINEAR,
    SPLINE;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
