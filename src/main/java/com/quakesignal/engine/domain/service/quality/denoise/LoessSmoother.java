package com.quakesignal.engine.domain.service.quality.denoise;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.analysis.interpolation.LoessInterpolator;
import org.apache.commons.math3.exception.MathIllegalArgumentException;

import java.util.Map;

@Slf4j
class LoessSmoother implements DenoiseStrategy {

    @Override
    public Map<String, Double> defaults() {
        return Map.of("span_points", 31.0, "robustness_iters", 2.0);
    }

    @Override
    public double[] apply(long[] tsMs, double[] values, Map<String, Double> params) {
        int finiteCount = 0;
        for (double v : values) {
            if (Double.isFinite(v)) finiteCount++;
        }
        double[] out = values.clone();
        if (finiteCount < 3) return out;

        double[] x = new double[finiteCount];
        double[] y = new double[finiteCount];
        int[] positions = new int[finiteCount];
        long origin = tsMs[0];
        int k = 0;
        for (int i = 0; i < values.length; i++) {
            if (Double.isFinite(values[i])) {
                x[k] = (tsMs[i] - origin) / 1000.0;
                y[k] = values[i];
                positions[k] = i;
                k++;
            }
        }

        double span = params.get("span_points");
        double bandwidth = Math.min(1.0, Math.max(span, 2.0) / finiteCount);
        if (bandwidth * finiteCount < 2.0) {
            bandwidth = Math.min(1.0, 2.0 / finiteCount);
        }
        int iterations = Math.max(0, params.get("robustness_iters").intValue());

        try {
            double[] smoothed = new LoessInterpolator(bandwidth, iterations).smooth(x, y);
            for (int j = 0; j < finiteCount; j++) {
                if (Double.isFinite(smoothed[j])) {
                    out[positions[j]] = smoothed[j];
                }
            }
        } catch (MathIllegalArgumentException e) {
            log.warn("[Quality] LOESS 평활화 불가, 원본 유지: points={}, reason={}", finiteCount, e.getMessage());
        }
        return out;
    }
}
