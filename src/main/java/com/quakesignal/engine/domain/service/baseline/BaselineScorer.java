package com.quakesignal.engine.domain.service.baseline;

import com.quakesignal.engine.domain.model.AlignedPoint;
import com.quakesignal.engine.domain.model.AlignedSeries;
import com.quakesignal.engine.domain.model.AnomalyScore;
import com.quakesignal.engine.domain.model.BaselineWindow;
import com.quakesignal.engine.domain.model.Feature;
import com.quakesignal.engine.domain.model.FeatureSet;
import com.quakesignal.engine.domain.model.LinkedDataset;
import com.quakesignal.engine.domain.model.SeriesKey;
import com.quakesignal.engine.domain.model.SourceType;
import com.quakesignal.engine.domain.service.feature.FeatureExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class BaselineScorer {

    private final BaselineProperties properties;
    private final BaselineSelector selector;
    private final ScoreAggregator aggregator;

    public AnomalyScore score(String eventId, SeriesKey key, long t0Ms, long tsMs, double value,
                              HistoryAccessor history, String paramsHash) {
        BaselineWindow baseline = selector.select(key, t0Ms, history);
        return score(eventId, key.stationId(), key.source(), key.channel(), tsMs, value, baseline, paramsHash);
    }

    public AnomalyScore score(String eventId, String stationId, SourceType source, String featureName,
                              long tsMs, double value, BaselineWindow baseline, String paramsHash) {
        AnomalyScore.AnomalyScoreBuilder builder = AnomalyScore.builder()
                .eventId(eventId)
                .stationId(stationId)
                .source(source)
                .featureName(featureName)
                .tsMs(tsMs)
                .value(Double.isFinite(value) ? value : null)
                .baselineMethod(baseline.getMethod())
                .degraded(baseline.isDegraded())
                .paramsHash(paramsHash);

        if (!Double.isFinite(value) || !baseline.isUsable()) {
            return builder.anomaly(false).build();
        }
        double score = squash(value, baseline.getMean(), baseline.getScale());
        Double rawZ = baseline.getScale() > 0 ? (value - baseline.getMedian()) / baseline.getScale() : null;
        return builder
                .score(score)
                .rawZ(rawZ)
                .anomaly(isAnomalous(score))
                .build();
    }

    public double squash(double value, double mean, double scale) {
        if (!(scale > 0)) {
            return Double.compare(value, mean) > 0 ? 1.0 : Double.compare(value, mean) < 0 ? 0.0 : 0.5;
        }
        double z = (value - mean) / scale;
        double score = 1.0 / (1.0 + Math.exp(-properties.getSteepness() * z));
        return Math.max(0.0, Math.min(1.0, score));
    }

    public boolean isAnomalous(double score) {
        double threshold = properties.getAnomalyThreshold();
        if (score >= threshold) return true;
        return properties.isTwoSided() && score <= 1.0 - threshold;
    }

    public EventScores scoreEvent(LinkedDataset dataset, HistoryAccessor history, String paramsHash) {
        String eventId = dataset.getEvent().eventId();
        long t0 = dataset.getEvent().originTimeMs();
        List<BaselineWindow> baselines = new ArrayList<>();
        List<AnomalyScore> scores = new ArrayList<>();

        for (AlignedSeries series : dataset.getSeries().values()) {
            SeriesKey key = series.getKey();
            BaselineSelector.SeriesBaseline baseline = selector.prepare(key, t0, history);
            for (AlignedPoint point : series.getPoints()) {
                if (!point.isPresent()) continue;
                scores.add(score(eventId, key.stationId(), key.source(), key.channel(),
                        point.getTsMs(), point.getValue(), baseline.windowAt(point.getTsMs()), paramsHash));
            }
            List<BaselineWindow> used = baseline.windows();
            baselines.addAll(used.isEmpty() ? List.of(baseline.windowAt(t0)) : used);
        }

        List<AnomalyScore> combined = aggregator.combine(scores, paramsHash);
        List<AnomalyScore> all = new ArrayList<>(scores.size() + combined.size());
        all.addAll(scores);
        all.addAll(combined);
        all.sort(AnomalyScores.ORDER);

        long anomalies = combined.stream().filter(AnomalyScore::isAnomaly).count();
        log.info("[Baseline] 이상 점수 산출 완료: event={}, series={}, scores={}, combinedAnomalies={}",
                eventId, dataset.getSeries().size(), scores.size(), anomalies);
        return new EventScores(baselines, all, combined.size(), (int) anomalies);
    }

    // history windows have the event window's length, shifted back by whole days
    public EventScores scoreFeatures(LinkedDataset dataset, List<FeatureSet> featureSets,
                                     FeatureHistoryAccessor history, String paramsHash) {
        String eventId = dataset.getEvent().eventId();
        long t0 = dataset.getEvent().originTimeMs();
        long windowStart = dataset.getSummary().getWindowStartMs();
        long windowEnd = dataset.getSummary().getWindowEndMs();
        long latestEnd = t0 - properties.getGapHours() * BaselineSelector.MS_PER_HOUR;
        int firstOffset = (int) Math.max(1, -Math.floorDiv(latestEnd - windowEnd, BaselineSelector.MS_PER_DAY));
        long earliestStart = t0 - properties.getHistoryDays() * BaselineSelector.MS_PER_DAY;

        List<BaselineWindow> baselines = new ArrayList<>();
        List<AnomalyScore> scores = new ArrayList<>();
        for (FeatureSet set : featureSets) {
            if (set.getFeatures().isEmpty()) continue;
            Map<String, SortedMap<Integer, Double>> pastValues = new TreeMap<>();
            for (int d = firstOffset; d < firstOffset + properties.getFeatureHistoryWindows(); d++) {
                long shift = d * BaselineSelector.MS_PER_DAY;
                if (windowStart - shift < earliestStart) break;
                int offset = d;
                history.features(set.getStationId(), set.getSource(), windowStart - shift, windowEnd - shift)
                        .forEach((name, value) -> pastValues.computeIfAbsent(name, k -> new TreeMap<>()).put(offset, value));
            }

            for (Feature feature : set.getFeatures()) {
                String name = feature.getFeatureName();
                if (FeatureExtractor.isTimeAnchored(name)) continue;
                BaselineWindow baseline = selector.selectFeature(set.getStationId(), set.getSource(), name, t0,
                        pastValues.getOrDefault(name, new TreeMap<>()));
                baselines.add(baseline);
                scores.add(score(eventId, set.getStationId(), set.getSource(), name, t0, feature.getValue(),
                        baseline, paramsHash));
            }
        }

        List<AnomalyScore> combined = aggregator.combine(scores, paramsHash, AnomalyScores.COMBINED_FEATURES);
        List<AnomalyScore> all = new ArrayList<>(scores.size() + combined.size());
        all.addAll(scores);
        all.addAll(combined);
        all.sort(AnomalyScores.ORDER);

        long anomalies = combined.stream().filter(AnomalyScore::isAnomaly).count();
        log.info("[Baseline] 특징 점수 산출 완료: event={}, featureSets={}, scores={}, combinedAnomalies={}",
                eventId, featureSets.size(), scores.size(), anomalies);
        return new EventScores(baselines, all, combined.size(), (int) anomalies);
    }

    public record EventScores(List<BaselineWindow> baselines, List<AnomalyScore> scores,
                              int combinedRows, int anomalyRows) {

        public double anomalyRate() {
            return combinedRows == 0 ? 0.0 : (double) anomalyRows / combinedRows;
        }

        public EventScores plus(EventScores other) {
            List<BaselineWindow> mergedBaselines = new ArrayList<>(baselines);
            mergedBaselines.addAll(other.baselines);
            List<AnomalyScore> mergedScores = new ArrayList<>(scores);
            mergedScores.addAll(other.scores);
            mergedScores.sort(AnomalyScores.ORDER);
            return new EventScores(mergedBaselines, mergedScores,
                    combinedRows + other.combinedRows, anomalyRows + other.anomalyRows);
        }
    }
}
