package com.quakesignal.engine.domain.service.quality.denoise;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

class DenoiseMethodTest {

    private static final int N = 64;

    @ParameterizedTest
    @EnumSource(DenoiseMethod.class)
    void nanInputsStayNaNAndLengthIsPreserved(DenoiseMethod method) {
        long[] ts = new long[N];
        double[] values = new double[N];
        for (int i = 0; i < N; i++) {
            ts[i] = i * 50L;
            values[i] = 10.0 + Math.sin(i / 4.0);
        }
        values[7] = Double.NaN;
        values[40] = Double.NaN;

        double[] out = method.apply(ts, values, method.effectiveParams(Map.of()));

        assertThat(out).hasSize(N);
        assertThat(out[7]).isNaN();
        assertThat(out[40]).isNaN();
        for (int i = 0; i < N; i++) {
            if (i != 7 && i != 40) {
                assertThat(Double.isFinite(out[i])).as("index %d for %s", i, method).isTrue();
            }
        }
    }

    @Test
    void noneReturnsAnIndependentCopy() {
        double[] values = {1.0, 2.0, 3.0};

        double[] out = DenoiseMethod.NONE.apply(new long[]{0, 1, 2}, values, Map.of());
        out[0] = 99.0;

        assertThat(values[0]).isEqualTo(1.0);
        assertThat(DenoiseMethod.NONE.isActive()).isFalse();
    }

    @Test
    void rollingMedianRemovesIsolatedSpike() {
        long[] ts = new long[11];
        double[] values = new double[11];
        for (int i = 0; i < 11; i++) {
            ts[i] = i * 1000L;
            values[i] = 5.0;
        }
        values[5] = 500.0;

        double[] out = DenoiseMethod.ROLLING_MEDIAN.apply(ts, values,
                DenoiseMethod.ROLLING_MEDIAN.effectiveParams(null));

        assertThat(out[5]).isEqualTo(5.0);
    }

    @Test
    void kalmanLeavesConstantSeriesUntouched() {
        long[] ts = {0, 60_000, 120_000, 180_000, 240_000};
        double[] values = {42.0, 42.0, 42.0, 42.0, 42.0};

        double[] out = DenoiseMethod.KALMAN.apply(ts, values, DenoiseMethod.KALMAN.effectiveParams(null));

        assertThat(out).containsExactly(42.0, 42.0, 42.0, 42.0, 42.0);
    }

    @Test
    void kalmanTracksTowardsNewLevel() {
        long[] ts = new long[50];
        double[] values = new double[50];
        for (int i = 0; i < 50; i++) {
            ts[i] = i * 1000L;
            values[i] = i < 25 ? 0.0 : 10.0;
        }

        double[] out = DenoiseMethod.KALMAN.apply(ts, values, DenoiseMethod.KALMAN.effectiveParams(null));

        assertThat(out[0]).isEqualTo(0.0);
        assertThat(out[26]).isBetween(0.0, 10.0);
        assertThat(out[49]).isGreaterThan(out[26]);
    }

    @Test
    void seismicBandpassRemovesOffsetAndTrend() {
        int n = 400;
        long[] ts = new long[n];
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            ts[i] = i * 50L;
            values[i] = 1000.0 + 0.5 * i + Math.sin(2 * Math.PI * 2.0 * i / 20.0);
        }

        double[] out = DenoiseMethod.SEISMIC_BANDPASS.apply(ts, values,
                DenoiseMethod.SEISMIC_BANDPASS.effectiveParams(null));

        double mean = 0.0;
        for (double v : out) mean += v / n;
        assertThat(mean).isCloseTo(0.0, offset(0.5));
    }

    @Test
    void configuredParamsOverrideDefaults() {
        Map<String, Double> params = DenoiseMethod.KALMAN.effectiveParams(Map.of("q_scale", 0.5));

        assertThat(params).containsEntry("q_scale", 0.5).containsEntry("r_scale", 1e-2);
        assertThat(DenoiseMethod.NONE.effectiveParams(null)).isEmpty();
        assertThat(DenoiseMethod.SEISMIC_BANDPASS.key()).isEqualTo("seismic_bandpass");
    }
}
