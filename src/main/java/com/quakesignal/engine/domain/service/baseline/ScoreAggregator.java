package com.quakesignal.engine.domain.service.baseline;

import com.quakesignal.engine.domain.model.AnomalyScore;
import com.quakesignal.engine.domain.model.BaselineMethod;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

@Component
@RequiredArgsConstructor
public class ScoreAggregator {

    private final BaselineProperties properties;

    public Double combine(List<AnomalyScore> perFeature) {
        double weighted = 0.0;
        double totalWeight = 0.0;
        Double extreme = null;
        for (AnomalyScore s : perFeature) {
            if (s.getScore() == null) continue;
            double score = s.getScore();
            if (extreme == null || extremeness(score) > extremeness(extreme)) {
                extreme = score;
            }
            double w = properties.weightFor(s.getFeatureName(), s.getSource().key());
            weighted += w * score;
            totalWeight += w;
        }
        if (extreme == null) return null;
        if (properties.getAggregation() == AggregationPolicy.WEIGHTED) {
            return totalWeight > 0 ? weighted / totalWeight : null;
        }
        return extreme;
    }

    List<AnomalyScore> combine(List<AnomalyScore> scores, String paramsHash) {
        return combine(scores, paramsHash, AnomalyScores.COMBINED);
    }

    List<AnomalyScore> combine(List<AnomalyScore> scores, String paramsHash, String combinedName) {
        Map<String, List<AnomalyScore>> groups = new TreeMap<>();
        for (AnomalyScore s : scores) {
            String group = s.getStationId() + "|" + s.getSource().key() + "|" + String.format(Locale.ROOT, "%020d", s.getTsMs());
            groups.computeIfAbsent(group, k -> new ArrayList<>()).add(s);
        }

        List<AnomalyScore> out = new ArrayList<>(groups.size());
        for (List<AnomalyScore> group : groups.values()) {
            AnomalyScore first = group.get(0);
            Double combined = combine(group);
            boolean degraded = group.stream().anyMatch(AnomalyScore::isDegraded);
            out.add(AnomalyScore.builder()
                    .eventId(first.getEventId())
                    .stationId(first.getStationId())
                    .source(first.getSource())
                    .featureName(combinedName)
                    .tsMs(first.getTsMs())
                    .score(combined)
                    .anomaly(combined != null && isAnomalous(combined))
                    .baselineMethod(weakestMethod(group))
                    .degraded(degraded)
                    .paramsHash(paramsHash)
                    .build());
        }
        return out;
    }

    private boolean isAnomalous(double score) {
        double threshold = properties.getAnomalyThreshold();
        return score >= threshold || (properties.isTwoSided() && score <= 1.0 - threshold);
    }

    private double extremeness(double score) {
        return properties.isTwoSided() ? Math.abs(score - 0.5) : score;
    }

    private BaselineMethod weakestMethod(List<AnomalyScore> group) {
        BaselineMethod weakest = BaselineMethod.PRIMARY;
        for (AnomalyScore s : group) {
            if (s.getBaselineMethod() != null && s.getBaselineMethod().ordinal() > weakest.ordinal()) {
                weakest = s.getBaselineMethod();
            }
        }
        return weakest;
    }
}
