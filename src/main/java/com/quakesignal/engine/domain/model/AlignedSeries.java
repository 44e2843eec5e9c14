package com.quakesignal.engine.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class AlignedSeries {

    private final SeriesKey key;
    private final AlignMethod method;
    private final long nativeIntervalMs;
    private final List<AlignedPoint> points;

    public double[] values() {
        double[] out = new double[points.size()];
        for (int i = 0; i < points.size(); i++) {
            AlignedPoint p = points.get(i);
            out[i] = p.isPresent() ? p.getValue() : Double.NaN;
        }
        return out;
    }

    public long[] timestamps() {
        long[] out = new long[points.size()];
        for (int i = 0; i < points.size(); i++) {
            out[i] = points.get(i).getTsMs();
        }
        return out;
    }

    public long presentCount() {
        return points.stream().filter(AlignedPoint::isPresent).count();
    }
}
