package com.quakesignal.engine.domain.service.baseline;

import com.quakesignal.engine.domain.model.AnomalyScore;

import java.util.Comparator;

final class AnomalyScores {

    static final String COMBINED = "combined";
    static final String COMBINED_FEATURES = "features:combined";

    static final Comparator<AnomalyScore> ORDER = Comparator
            .comparing(AnomalyScore::getStationId)
            .thenComparing(AnomalyScore::getSource)
            .thenComparing(AnomalyScore::getFeatureName)
            .thenComparingLong(AnomalyScore::getTsMs);

    private AnomalyScores() {
    }
}
