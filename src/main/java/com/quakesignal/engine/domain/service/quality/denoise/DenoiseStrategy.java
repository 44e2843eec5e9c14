package com.quakesignal.engine.domain.service.quality.denoise;

import java.util.Map;

public interface DenoiseStrategy {

    Map<String, Double> defaults();

    double[] apply(long[] tsMs, double[] values, Map<String, Double> params);

    default Map<String, Double> resolve(double[] values, Map<String, Double> params) {
        return params;
    }
}
