package com.quakesignal.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.SortedMap;

@Getter
@Builder
@JsonPropertyOrder({"event_id", "state", "window_start_ms", "window_end_ms", "grid_step_ms", "grid_size",
        "station_count", "series_count", "row_count", "present_rows", "coverage", "missing_rate",
        "join_coverage", "notes", "parameters", "params_hash"})
public class LinkSummary {

    private final String eventId;
    private final LinkState state;
    private final long windowStartMs;
    private final long windowEndMs;
    private final long gridStepMs;
    private final int gridSize;
    private final int stationCount;
    private final int seriesCount;
    private final int rowCount;
    private final int presentRows;
    private final double coverage;
    private final double missingRate;
    private final double joinCoverage;
    private final List<String> notes;
    private final SortedMap<String, Object> parameters;
    private final String paramsHash;
}
