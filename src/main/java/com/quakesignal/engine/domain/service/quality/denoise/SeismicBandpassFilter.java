package com.quakesignal.engine.domain.service.quality.denoise;

import com.quakesignal.engine.domain.service.signal.SamplingIntervals;
import com.quakesignal.engine.domain.service.signal.Spectrum;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import java.util.Map;

class SeismicBandpassFilter implements DenoiseStrategy {

    @Override
    public Map<String, Double> defaults() {
        return Map.of("freq_min_hz", 0.1, "freq_max_hz", 10.0, "taper_fraction", 0.05);
    }

    @Override
    public double[] apply(long[] tsMs, double[] values, Map<String, Double> params) {
        int n = values.length;
        double[] out = values.clone();
        double sampleRate = SamplingIntervals.sampleRateHz(tsMs);
        if (n < 4 || sampleRate <= 0) return out;

        SimpleRegression trend = new SimpleRegression();
        for (int i = 0; i < n; i++) {
            if (Double.isFinite(values[i])) {
                trend.addData(i, values[i]);
            }
        }
        if (trend.getN() < 2) return out;

        double[] work = new double[n];
        for (int i = 0; i < n; i++) {
            work[i] = Double.isFinite(values[i]) ? values[i] - trend.predict(i) : 0.0;
        }
        applyTukeyTaper(work, params.get("taper_fraction"));

        double nyquist = sampleRate / 2.0;
        double low = Math.max(0.0, params.get("freq_min_hz"));
        double high = Math.min(nyquist, params.get("freq_max_hz"));
        double[] filtered = Spectrum.bandPass(work, sampleRate, low, high);
        for (int i = 0; i < n; i++) {
            out[i] = Double.isFinite(values[i]) ? filtered[i] : Double.NaN;
        }
        return out;
    }

    static void applyTukeyTaper(double[] data, double fraction) {
        int n = data.length;
        int taperLength = (int) Math.floor(Math.max(0.0, Math.min(0.5, fraction)) * n);
        if (taperLength < 1) return;
        for (int i = 0; i < taperLength; i++) {
            double w = 0.5 * (1.0 - Math.cos(Math.PI * i / taperLength));
            data[i] *= w;
            data[n - 1 - i] *= w;
        }
    }
}
