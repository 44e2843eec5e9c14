package com.quakesignal.engine.domain.service.align;

import com.quakesignal.engine.domain.exception.InvalidConfigurationException;

public record GridSpec(long startMs, long endMs, long stepMs) {

    public GridSpec {
        if (stepMs <= 0) {
            throw new InvalidConfigurationException("grid step must be positive: " + stepMs);
        }
        if (endMs < startMs) {
            throw new InvalidConfigurationException("grid end precedes start: " + startMs + " > " + endMs);
        }
    }

    public static GridSpec covering(long windowStartMs, long windowEndMs, long stepMs) {
        if (stepMs <= 0) {
            throw new InvalidConfigurationException("grid step must be positive: " + stepMs);
        }
        long first = Math.floorDiv(windowStartMs + stepMs - 1, stepMs) * stepMs;
        long last = Math.floorDiv(windowEndMs, stepMs) * stepMs;
        if (last < first) {
            last = first;
        }
        return new GridSpec(first, last, stepMs);
    }

    public int size() {
        return (int) ((endMs - startMs) / stepMs) + 1;
    }

    public long timestampAt(int index) {
        return startMs + index * stepMs;
    }

    public int bucketOf(long tsMs) {
        if (tsMs < startMs || tsMs >= endMs + stepMs) return -1;
        return (int) ((tsMs - startMs) / stepMs);
    }
}
