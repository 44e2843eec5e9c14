package com.quakesignal.engine.domain.service.signal;

import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;

public final class Spectrum {

    private final double[] frequencies;
    private final double[] amplitudes;

    private Spectrum(double[] frequencies, double[] amplitudes) {
        this.frequencies = frequencies;
        this.amplitudes = amplitudes;
    }

    public static Spectrum of(double[] samples, double sampleRateHz) {
        return transform(samples, 0.0, sampleRateHz);
    }

    // non-finite samples and zero padding both sit at the mean
    public static Spectrum ofCentered(double[] samples, double sampleRateHz) {
        double sum = 0.0;
        int finite = 0;
        for (double v : samples) {
            if (Double.isFinite(v)) {
                sum += v;
                finite++;
            }
        }
        return transform(samples, finite > 0 ? sum / finite : 0.0, sampleRateHz);
    }

    private static Spectrum transform(double[] samples, double offset, double sampleRateHz) {
        int n = nextPowerOfTwo(Math.max(samples.length, 2));
        double[][] data = new double[2][n];
        for (int i = 0; i < samples.length; i++) {
            data[0][i] = Double.isFinite(samples[i]) ? samples[i] - offset : 0.0;
        }
        FastFourierTransformer.transformInPlace(data, DftNormalization.STANDARD, TransformType.FORWARD);

        int bins = n / 2 + 1;
        double[] freqs = new double[bins];
        double[] amps = new double[bins];
        for (int k = 0; k < bins; k++) {
            freqs[k] = k * sampleRateHz / n;
            amps[k] = Math.hypot(data[0][k], data[1][k]);
        }
        return new Spectrum(freqs, amps);
    }

    public static double[] bandPass(double[] samples, double sampleRateHz, double lowHz, double highHz) {
        int n = nextPowerOfTwo(Math.max(samples.length, 2));
        double[][] data = new double[2][n];
        for (int i = 0; i < samples.length; i++) {
            data[0][i] = samples[i];
        }
        FastFourierTransformer.transformInPlace(data, DftNormalization.STANDARD, TransformType.FORWARD);
        for (int k = 0; k < n; k++) {
            int mirrored = k <= n / 2 ? k : n - k;
            double f = mirrored * sampleRateHz / n;
            if (f < lowHz || f > highHz) {
                data[0][k] = 0.0;
                data[1][k] = 0.0;
            }
        }
        FastFourierTransformer.transformInPlace(data, DftNormalization.STANDARD, TransformType.INVERSE);
        double[] out = new double[samples.length];
        System.arraycopy(data[0], 0, out, 0, samples.length);
        return out;
    }

    public static int nextPowerOfTwo(int n) {
        int p = 1;
        while (p < n) {
            p <<= 1;
        }
        return p;
    }

    public int peakIndex() {
        if (amplitudes.length < 2) return 0;
        int best = 1;
        for (int k = 2; k < amplitudes.length; k++) {
            if (amplitudes[k] > amplitudes[best]) best = k;
        }
        return best;
    }

    public double peakFrequency() {
        return frequencies[peakIndex()];
    }

    public double peakAmplitude() {
        return amplitudes[peakIndex()];
    }

    public double bandPower(double lowHz, double highHz) {
        double power = 0.0;
        for (int k = 0; k < frequencies.length; k++) {
            if (frequencies[k] >= lowHz && frequencies[k] <= highHz) {
                power += amplitudes[k] * amplitudes[k];
            }
        }
        return power;
    }

    public double[] frequencies() {
        return frequencies.clone();
    }

    public double[] amplitudes() {
        return amplitudes.clone();
    }
}
