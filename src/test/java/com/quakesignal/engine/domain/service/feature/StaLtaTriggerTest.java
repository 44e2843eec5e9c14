package com.quakesignal.engine.domain.service.feature;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class StaLtaTriggerTest {

    private final StaLtaTrigger trigger = new StaLtaTrigger(3, 30, 3.0, 1.5);

    @Test
    void burstAboveBackgroundMarksOnsetOnceRatioSettles() {
        double[] envelope = new double[150];
        long[] ts = new long[150];
        for (int i = 0; i < envelope.length; i++) {
            ts[i] = i * 1000L;
            envelope[i] = i >= 100 && i < 105 ? 5.0 : 0.1;
        }

        StaLtaTrigger.Detection detection = trigger.detect(ts, envelope);

        assertThat(detection.hasOnset()).isTrue();
        assertThat(detection.onsetTsMs()).isEqualTo(100_000L);
        assertThat(detection.maxRatio()).isGreaterThan(3.0);
    }

    @Test
    void ratioThatNeverSettlesReportsNoOnset() {
        double[] envelope = new double[60];
        long[] ts = new long[60];
        for (int i = 0; i < envelope.length; i++) {
            ts[i] = i * 1000L;
            envelope[i] = i < 50 ? 0.1 : 10.0;
        }

        StaLtaTrigger.Detection detection = trigger.detect(ts, envelope);

        assertThat(detection.hasOnset()).isFalse();
        assertThat(detection.maxRatio()).isGreaterThan(3.0);
    }

    @Test
    void ratiosAreUndefinedUntilLongWindowFills() {
        double[] envelope = new double[40];
        Arrays.fill(envelope, 1.0);

        double[] ratios = trigger.ratios(envelope);

        assertThat(ratios[28]).isNaN();
        assertThat(ratios[29]).isEqualTo(1.0);
    }
}
