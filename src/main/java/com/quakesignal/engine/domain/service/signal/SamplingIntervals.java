package com.quakesignal.engine.domain.service.signal;

import java.util.Arrays;

public final class SamplingIntervals {

    private SamplingIntervals() {
    }

    public static long medianIntervalMs(long[] tsMs) {
        if (tsMs.length < 2) return 0L;
        long[] diffs = new long[tsMs.length - 1];
        int n = 0;
        for (int i = 1; i < tsMs.length; i++) {
            long d = tsMs[i] - tsMs[i - 1];
            if (d > 0) diffs[n++] = d;
        }
        if (n == 0) return 0L;
        long[] positive = Arrays.copyOf(diffs, n);
        Arrays.sort(positive);
        return positive[n / 2];
    }

    public static double sampleRateHz(long[] tsMs) {
        long interval = medianIntervalMs(tsMs);
        return interval > 0 ? 1000.0 / interval : 0.0;
    }
}
