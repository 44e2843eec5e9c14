package com.quakesignal.engine.domain.model;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder(toBuilder = true)
public class AlignedPoint {

    private final long tsMs;
    private final double value;
    @Builder.Default
    private final double std = Double.NaN;
    @Builder.Default
    private final double min = Double.NaN;
    @Builder.Default
    private final double max = Double.NaN;
    @Builder.Default
    private final double peakToPeak = Double.NaN;
    @Builder.Default
    private final double gradient = Double.NaN;
    private final int sampleCount;
    private final boolean missing;
    private final boolean interpolated;
    private final String interpMethod;

    public static AlignedPoint missingAt(long tsMs) {
        return AlignedPoint.builder()
                .tsMs(tsMs)
                .value(Double.NaN)
                .sampleCount(0)
                .missing(true)
                .build();
    }

    public boolean isPresent() {
        return !missing && Double.isFinite(value);
    }
}
