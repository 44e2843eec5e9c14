package com.quakesignal.engine.domain.service.quality;

import java.util.Locale;

public enum OutlierMethod {
    MAD,
    ZSCORE;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
