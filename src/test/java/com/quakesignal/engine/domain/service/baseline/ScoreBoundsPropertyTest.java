package com.quakesignal.engine.domain.service.baseline;

import com.quakesignal.engine.domain.model.AnomalyScore;
import com.quakesignal.engine.domain.model.BaselineMethod;
import com.quakesignal.engine.domain.model.BaselineWindow;
import com.quakesignal.engine.domain.model.SourceType;
import com.quakesignal.engine.domain.service.link.LinkProperties;
import com.quakesignal.engine.domain.service.signal.RobustStats;
import net.jqwik.api.*;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for anomaly score bounds.
 */
class ScoreBoundsPropertyTest {

    private final BaselineProperties properties = new BaselineProperties();
    private final BaselineScorer scorer = new BaselineScorer(properties,
            new BaselineSelector(properties, new LinkProperties()), new ScoreAggregator(properties));

    /**
     * Property: Every score lies in [0, 1] whatever the value and baseline.
     */
    @Property(tries = 100)
    void scoreIsAlwaysWithinUnitInterval(@ForAll("baselines") double[] samples,
                                         @ForAll("featureValues") Double value) {
        AnomalyScore score = scorer.score("E1", "KAK", SourceType.AEF, "Ez", 0L, value, window(samples), "h");

        assertThat(score.getScore()).isNotNull();
        assertThat(score.getScore()).isBetween(0.0, 1.0);
    }

    /**
     * Property: A value equal to the baseline mean scores exactly one half.
     */
    @Property(tries = 100)
    void baselineMeanScoresOneHalf(@ForAll("baselines") double[] samples) {
        BaselineWindow window = window(samples);

        AnomalyScore score = scorer.score("E1", "KAK", SourceType.AEF, "Ez", 0L, window.getMean(), window, "h");

        assertThat(score.getScore()).isEqualTo(0.5);
        assertThat(score.isAnomaly()).isFalse();
    }

    /**
     * Property: Combined scores stay in [0, 1] under both aggregation policies.
     */
    @Property(tries = 100)
    void combinedScoreIsBounded(@ForAll("unitScores") List<Double> scores, @ForAll AggregationPolicy policy) {
        properties.setAggregation(policy);
        List<AnomalyScore> perFeature = scores.stream()
                .map(s -> AnomalyScore.builder()
                        .stationId("KAK")
                        .source(SourceType.VLF)
                        .featureName("f" + s.hashCode())
                        .score(s)
                        .baselineMethod(BaselineMethod.PRIMARY)
                        .build())
                .toList();

        Double combined = new ScoreAggregator(properties).combine(perFeature);

        assertThat(combined).isBetween(0.0, 1.0);
    }

    @Provide
    Arbitrary<double[]> baselines() {
        return Arbitraries.doubles().between(-1e6, 1e6).array(double[].class).ofMinSize(1).ofMaxSize(200);
    }

    @Provide
    Arbitrary<Double> featureValues() {
        return Arbitraries.oneOf(
                Arbitraries.doubles().between(-1e9, 1e9),
                Arbitraries.of(0.0, -0.0, Double.MAX_VALUE, -Double.MAX_VALUE));
    }

    @Provide
    Arbitrary<List<Double>> unitScores() {
        return Arbitraries.doubles().between(0.0, 1.0).list().ofMinSize(1).ofMaxSize(12);
    }

    private static BaselineWindow window(double[] samples) {
        double median = RobustStats.median(samples);
        return BaselineWindow.builder()
                .stationId("KAK")
                .source(SourceType.AEF)
                .featureName("Ez")
                .samples(samples)
                .method(BaselineMethod.PRIMARY)
                .median(median)
                .mean(RobustStats.mean(samples))
                .scale(RobustStats.robustScale(samples, median))
                .build();
    }
}
