package com.quakesignal.engine.domain.model;

import java.util.List;

public record QualityResult(SeriesKey key, List<CanonicalRecord> records, QualityReport report,
                            FilterEffect filterEffect) {

    public QualityResult(SeriesKey key, List<CanonicalRecord> records, QualityReport report) {
        this(key, records, report, null);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
