package com.quakesignal.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
@JsonPropertyOrder({"ts_ms", "station_id", "source", "channel", "value", "std", "min", "max",
        "peak_to_peak", "gradient", "sample_count", "is_missing", "is_interpolated", "interp_method", "align_method"})
public class AlignedRow {

    private final long tsMs;
    private final String stationId;
    private final SourceType source;
    private final String channel;
    private final Double value;
    private final Double std;
    private final Double min;
    private final Double max;
    private final Double peakToPeak;
    private final Double gradient;
    private final int sampleCount;
    @JsonProperty("is_missing")
    private final boolean missing;
    @JsonProperty("is_interpolated")
    private final boolean interpolated;
    private final String interpMethod;
    private final AlignMethod alignMethod;

    public static AlignedRow of(SeriesKey key, AlignMethod method, AlignedPoint point) {
        return AlignedRow.builder()
                .tsMs(point.getTsMs())
                .stationId(key.stationId())
                .source(key.source())
                .channel(key.channel())
                .value(finiteOrNull(point.getValue()))
                .std(finiteOrNull(point.getStd()))
                .min(finiteOrNull(point.getMin()))
                .max(finiteOrNull(point.getMax()))
                .peakToPeak(finiteOrNull(point.getPeakToPeak()))
                .gradient(finiteOrNull(point.getGradient()))
                .sampleCount(point.getSampleCount())
                .missing(point.isMissing())
                .interpolated(point.isInterpolated())
                .interpMethod(point.getInterpMethod())
                .alignMethod(method)
                .build();
    }

    private static Double finiteOrNull(double v) {
        return Double.isFinite(v) ? v : null;
    }
}
