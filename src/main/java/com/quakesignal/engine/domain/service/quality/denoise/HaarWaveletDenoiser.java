package com.quakesignal.engine.domain.service.quality.denoise;

import com.quakesignal.engine.domain.service.signal.RobustStats;

import java.util.Map;

class HaarWaveletDenoiser implements DenoiseStrategy {

    private static final double SQRT2 = Math.sqrt(2.0);
    private static final double MAD_TO_NOISE = 0.6745;

    @Override
    public Map<String, Double> defaults() {
        return Map.of("levels", 3.0);
    }

    @Override
    public double[] apply(long[] tsMs, double[] values, Map<String, Double> params) {
        double[] signal = RobustStats.finite(values);
        double[] out = values.clone();
        if (signal.length < 4) return out;

        int levels = Math.max(1, params.get("levels").intValue());
        double[] coeffs = signal.clone();
        int[] lengths = new int[levels];
        int length = coeffs.length;
        int applied = 0;
        for (int level = 0; level < levels && length >= 2; level++) {
            lengths[level] = length;
            forward(coeffs, length);
            length = (length + 1) / 2;
            applied++;
        }

        int firstDetailLength = signal.length / 2;
        double[] finestDetail = new double[firstDetailLength];
        System.arraycopy(coeffs, (signal.length + 1) / 2, finestDetail, 0, firstDetailLength);
        double sigma = RobustStats.median(absolute(finestDetail)) / MAD_TO_NOISE;
        double threshold = sigma * Math.sqrt(2.0 * Math.log(signal.length));

        for (int i = length; i < signal.length; i++) {
            coeffs[i] = softThreshold(coeffs[i], threshold);
        }
        for (int level = applied - 1; level >= 0; level--) {
            inverse(coeffs, lengths[level]);
        }

        int k = 0;
        for (int i = 0; i < values.length; i++) {
            if (Double.isFinite(values[i])) {
                out[i] = coeffs[k++];
            }
        }
        return out;
    }

    private static void forward(double[] data, int length) {
        int pairs = length / 2;
        int approxLength = (length + 1) / 2;
        double[] tmp = new double[length];
        for (int i = 0; i < pairs; i++) {
            double a = data[2 * i];
            double b = data[2 * i + 1];
            tmp[i] = (a + b) / SQRT2;
            tmp[approxLength + i] = (a - b) / SQRT2;
        }
        if (length % 2 == 1) {
            tmp[pairs] = data[length - 1];
        }
        System.arraycopy(tmp, 0, data, 0, length);
    }

    private static void inverse(double[] data, int length) {
        int pairs = length / 2;
        int approxLength = (length + 1) / 2;
        double[] tmp = new double[length];
        for (int i = 0; i < pairs; i++) {
            double s = data[i];
            double d = data[approxLength + i];
            tmp[2 * i] = (s + d) / SQRT2;
            tmp[2 * i + 1] = (s - d) / SQRT2;
        }
        if (length % 2 == 1) {
            tmp[length - 1] = data[pairs];
        }
        System.arraycopy(tmp, 0, data, 0, length);
    }

    private static double softThreshold(double c, double threshold) {
        double magnitude = Math.abs(c) - threshold;
        return magnitude > 0 ? Math.signum(c) * magnitude : 0.0;
    }

    private static double[] absolute(double[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = Math.abs(values[i]);
        }
        return out;
    }
}
