package com.quakesignal.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Getter;

import java.util.Locale;

@Getter
@Builder
@JsonPropertyOrder({"event_id", "status", "station_hits", "aligned_rows", "join_coverage",
        "feature_count", "anomaly_rows", "anomaly_rate", "error"})
public class EventRunResult {

    private final String eventId;
    private final Status status;
    private final int stationHits;
    private final int alignedRows;
    private final double joinCoverage;
    private final int featureCount;
    private final int anomalyRows;
    private final double anomalyRate;
    private final String error;

    public enum Status {
        LINKED, SKIPPED, FAILED;

        @JsonValue
        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
