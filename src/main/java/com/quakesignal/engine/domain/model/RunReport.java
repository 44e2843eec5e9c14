package com.quakesignal.engine.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class RunReport {

    private final String paramsHash;
    private final long inputRecords;
    private final long rejectedRecords;
    private final int seriesProcessed;
    private final int seriesFailed;
    private final int partitionsWritten;
    private final int partitionsSkipped;
    private final int stationCount;
    private final List<QualityReport> qualityReports;
    private final List<EventRunResult> events;

    public long eventsWithStatus(EventRunResult.Status status) {
        return events.stream().filter(e -> e.getStatus() == status).count();
    }
}
