package com.quakesignal.engine.domain.service.quality.denoise;

import org.apache.commons.math3.stat.regression.SimpleRegression;

import java.util.Map;

class DetrendSmoother implements DenoiseStrategy {

    @Override
    public Map<String, Double> defaults() {
        return Map.of("window", 5.0);
    }

    @Override
    public double[] apply(long[] tsMs, double[] values, Map<String, Double> params) {
        int n = values.length;
        int half = Math.max(0, params.get("window").intValue() / 2);
        double[] out = new double[n];
        if (n == 0) return out;

        SimpleRegression trend = new SimpleRegression();
        long origin = tsMs[0];
        for (int i = 0; i < n; i++) {
            if (Double.isFinite(values[i])) {
                trend.addData((tsMs[i] - origin) / 1000.0, values[i]);
            }
        }
        boolean hasTrend = trend.getN() >= 2;

        double[] residual = new double[n];
        for (int i = 0; i < n; i++) {
            residual[i] = values[i] - (hasTrend ? trend.predict((tsMs[i] - origin) / 1000.0) : 0.0);
        }

        for (int i = 0; i < n; i++) {
            if (!Double.isFinite(values[i])) {
                out[i] = Double.NaN;
                continue;
            }
            double sum = 0.0;
            int count = 0;
            for (int j = Math.max(0, i - half); j <= Math.min(n - 1, i + half); j++) {
                if (Double.isFinite(residual[j])) {
                    sum += residual[j];
                    count++;
                }
            }
            double smoothed = sum / count;
            out[i] = smoothed + (hasTrend ? trend.predict((tsMs[i] - origin) / 1000.0) : 0.0);
        }
        return out;
    }
}
