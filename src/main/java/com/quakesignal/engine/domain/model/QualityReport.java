package com.quakesignal.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder(toBuilder = true)
@JsonPropertyOrder({"series_key", "input_rows", "output_rows", "dropped_parse_errors", "parse_error_points",
        "duplicates_collapsed", "reordered", "sentinel_count", "outlier_count", "interpolated_count",
        "unfilled_gap_runs", "inserted_gap_rows", "missing_rate", "denoise_method", "ts_min", "ts_max"})
public class QualityReport {

    private final String seriesKey;
    private final int inputRows;
    private final int outputRows;
    private final int droppedParseErrors;
    private final int parseErrorPoints;
    private final int duplicatesCollapsed;
    private final boolean reordered;
    private final int sentinelCount;
    private final int outlierCount;
    private final int interpolatedCount;
    private final int unfilledGapRuns;
    private final int insertedGapRows;
    private final double missingRate;
    private final String denoiseMethod;
    private final Long tsMin;
    private final Long tsMax;
}
