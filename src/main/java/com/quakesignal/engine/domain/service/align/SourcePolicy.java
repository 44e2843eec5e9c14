package com.quakesignal.engine.domain.service.align;

import com.quakesignal.engine.domain.model.SourceType;

public record SourcePolicy(SourceType source,
                           boolean forwardFill,
                           int forwardFillLimit,
                           long reindexToleranceMs,
                           long rawWaveformIntervalMs) {

    public static SourcePolicy strict(SourceType source) {
        return new SourcePolicy(source, false, 0, 0L, 1000L);
    }
}
