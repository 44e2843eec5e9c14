package com.quakesignal.engine.domain.service.quality.denoise;

import com.quakesignal.engine.domain.service.signal.RobustStats;

import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

class KalmanSmoother implements DenoiseStrategy {

    static final double FALLBACK_Q = 1e-6;
    static final double FALLBACK_R = 1e-2;
    static final double MIN_VARIANCE = 1e-12;

    @Override
    public Map<String, Double> defaults() {
        return Map.of("q_scale", 1e-5, "r_scale", 1e-2);
    }

    @Override
    public Map<String, Double> resolve(double[] values, Map<String, Double> params) {
        double[] finite = RobustStats.finite(values);
        double q = FALLBACK_Q;
        double r = FALLBACK_R;
        if (finite.length >= 2) {
            double variance = Math.max(RobustStats.populationVariance(finite), MIN_VARIANCE);
            q = variance * params.get("q_scale");
            r = variance * params.get("r_scale");
        }
        Map<String, Double> resolved = new TreeMap<>(params);
        resolved.put("q", q);
        resolved.put("r", r);
        return resolved;
    }

    @Override
    public double[] apply(long[] tsMs, double[] values, Map<String, Double> params) {
        double[] out = new double[values.length];
        double[] finite = RobustStats.finite(values);
        if (finite.length == 0) {
            Arrays.fill(out, Double.NaN);
            return out;
        }

        Map<String, Double> resolved = resolve(values, params);
        double q = resolved.get("q");
        double r = resolved.get("r");

        double estimate = Double.NaN;
        double p = 1.0;
        boolean started = false;
        for (int i = 0; i < values.length; i++) {
            double z = values[i];
            if (!started) {
                if (Double.isFinite(z)) {
                    estimate = z;
                    started = true;
                }
                out[i] = Double.isFinite(z) ? estimate : Double.NaN;
                continue;
            }
            p += q;
            if (!Double.isFinite(z)) {
                out[i] = Double.NaN;
                continue;
            }
            double gain = p / (p + r);
            estimate += gain * (z - estimate);
            p = (1.0 - gain) * p;
            out[i] = estimate;
        }
        return out;
    }
}
