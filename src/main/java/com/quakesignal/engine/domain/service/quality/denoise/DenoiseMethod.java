package com.quakesignal.engine.domain.service.quality.denoise;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

public enum DenoiseMethod {

    NONE(null),
    KALMAN(new KalmanSmoother()),
    DETREND_SMOOTH(new DetrendSmoother()),
    ROBUST_SMOOTH(new LoessSmoother()),
    WAVELET(new HaarWaveletDenoiser()),
    ROLLING_MEDIAN(new RollingMedianSmoother()),
    SEISMIC_BANDPASS(new SeismicBandpassFilter());

    private final DenoiseStrategy strategy;

    DenoiseMethod(DenoiseStrategy strategy) {
        this.strategy = strategy;
    }

    public boolean isActive() {
        return strategy != null;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public Map<String, Double> effectiveParams(Map<String, Double> configured) {
        Map<String, Double> params = new TreeMap<>();
        if (strategy != null) {
            params.putAll(strategy.defaults());
        }
        if (configured != null) {
            params.putAll(configured);
        }
        return params;
    }

    public Map<String, Double> resolvedParams(double[] values, Map<String, Double> effectiveParams) {
        if (strategy == null) {
            return effectiveParams;
        }
        return new TreeMap<>(strategy.resolve(values, effectiveParams));
    }

    public double[] apply(long[] tsMs, double[] values, Map<String, Double> effectiveParams) {
        if (strategy == null) {
            return values.clone();
        }
        double[] out = strategy.apply(tsMs, values, effectiveParams);
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                out[i] = Double.NaN;
            }
        }
        return out;
    }
}
