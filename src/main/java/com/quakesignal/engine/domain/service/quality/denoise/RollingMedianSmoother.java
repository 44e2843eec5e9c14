package com.quakesignal.engine.domain.service.quality.denoise;

import org.apache.commons.math3.stat.descriptive.rank.Median;

import java.util.Map;

class RollingMedianSmoother implements DenoiseStrategy {

    @Override
    public Map<String, Double> defaults() {
        return Map.of("window", 5.0);
    }

    @Override
    public double[] apply(long[] tsMs, double[] values, Map<String, Double> params) {
        int n = values.length;
        int half = Math.max(0, params.get("window").intValue() / 2);
        double[] out = new double[n];
        double[] buffer = new double[2 * half + 1];
        Median median = new Median();

        for (int i = 0; i < n; i++) {
            if (!Double.isFinite(values[i])) {
                out[i] = Double.NaN;
                continue;
            }
            int count = 0;
            for (int j = Math.max(0, i - half); j <= Math.min(n - 1, i + half); j++) {
                if (Double.isFinite(values[j])) {
                    buffer[count++] = values[j];
                }
            }
            out[i] = median.evaluate(buffer, 0, count);
        }
        return out;
    }
}
