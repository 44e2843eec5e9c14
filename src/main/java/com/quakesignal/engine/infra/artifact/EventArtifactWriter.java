package com.quakesignal.engine.infra.artifact;

import com.quakesignal.engine.domain.model.AnomalyScore;
import com.quakesignal.engine.domain.model.BaselineWindow;
import com.quakesignal.engine.domain.model.Feature;
import com.quakesignal.engine.domain.model.FeatureSet;
import com.quakesignal.engine.domain.model.LinkedDataset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Slf4j
@Component
public class EventArtifactWriter {

    private static final Comparator<Feature> FEATURE_ORDER = Comparator
            .comparing(Feature::getStationId)
            .thenComparing(Feature::getSource)
            .thenComparing(Feature::getFeatureName);

    private static final Comparator<BaselineWindow> BASELINE_ORDER = Comparator
            .comparing(BaselineWindow::getStationId)
            .thenComparing(BaselineWindow::getSource)
            .thenComparing(BaselineWindow::getFeatureName);

    private final AtomicJsonWriter writer = new AtomicJsonWriter(ArtifactJson.mapper());

    public Path linkedDir(Path outputDir, String eventId) {
        return outputDir.resolve("linked").resolve("event_id=" + eventId);
    }

    public Path featuresDir(Path outputDir, String eventId) {
        return outputDir.resolve("features").resolve("event_id=" + eventId);
    }

    public void writeLinked(Path outputDir, LinkedDataset dataset) {
        Path dir = linkedDir(outputDir, dataset.getEvent().eventId());
        writer.write(dir.resolve("event.json"), dataset.getEvent());
        writer.write(dir.resolve("stations.json"), dataset.getStations());
        writer.write(dir.resolve("aligned.json"), dataset.getRows());
        writer.write(dir.resolve("summary.json"), dataset.getSummary());
        log.debug("[Artifact] 연결 산출물 기록: dir={}, rows={}", dir, dataset.getRows().size());
    }

    public void writeFeatures(Path outputDir, String eventId, List<FeatureSet> featureSets,
                              List<BaselineWindow> baselines, List<AnomalyScore> scores) {
        Path dir = featuresDir(outputDir, eventId);

        List<Feature> features = new ArrayList<>();
        featureSets.forEach(set -> features.addAll(set.getFeatures()));
        features.sort(FEATURE_ORDER);
        List<BaselineWindow> orderedBaselines = new ArrayList<>(baselines);
        orderedBaselines.sort(BASELINE_ORDER);

        writer.write(dir.resolve("features.json"), features);
        writer.write(dir.resolve("baselines.json"), orderedBaselines);
        writer.write(dir.resolve("anomalies.json"), scores);
        log.debug("[Artifact] 특징/이상 산출물 기록: dir={}, features={}, scores={}", dir, features.size(), scores.size());
    }
}
