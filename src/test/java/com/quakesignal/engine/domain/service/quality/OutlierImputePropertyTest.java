package com.quakesignal.engine.domain.service.quality;

import com.quakesignal.engine.domain.model.CanonicalRecord;
import com.quakesignal.engine.domain.model.SourceType;
import net.jqwik.api.*;

import java.util.ArrayList;
import java.util.List;

import static com.quakesignal.engine.support.Records.MINUTE_MS;
import static com.quakesignal.engine.support.Records.record;
import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for outlier handling and gap imputation.
 */
class OutlierImputePropertyTest {

    private static final long T0 = 1_672_531_200_000L;

    /**
     * Property: An interpolated value never spans a gap longer than the configured maximum.
     */
    @Property(tries = 100)
    void interpolationNeverExceedsMaxGap(@ForAll("gappySeries") List<CanonicalRecord> input) {
        QualityProperties properties = new QualityProperties();
        GapImputer imputer = new GapImputer(properties);

        GapImputer.Result result = imputer.apply(input);

        for (CanonicalRecord row : result.records()) {
            if (row.getQualityFlags().isInterpolated()) {
                assertThat(row.getQualityFlags().getGapMs())
                        .as("gap of %s", row)
                        .isLessThanOrEqualTo(properties.maxGapMs());
                assertThat(row.hasFiniteValue()).isTrue();
            }
        }
    }

    /**
     * Property: Missing rows carry NaN and every non-finite row is flagged missing.
     */
    @Property(tries = 100)
    void missingFlagMatchesNaNValues(@ForAll("gappySeries") List<CanonicalRecord> input) {
        GapImputer imputer = new GapImputer(new QualityProperties());

        GapImputer.Result result = imputer.apply(input);

        for (CanonicalRecord row : result.records()) {
            assertThat(row.getQualityFlags().isMissing()).isEqualTo(!row.hasFiniteValue());
        }
        assertThat(result.records()).hasSize(input.size() + result.insertedGapRows());
    }

    /**
     * Property: Imputation keeps timestamps strictly increasing.
     */
    @Property(tries = 100)
    void imputationKeepsTimeOrder(@ForAll("gappySeries") List<CanonicalRecord> input) {
        GapImputer.Result result = new GapImputer(new QualityProperties()).apply(input);

        for (int i = 1; i < result.records().size(); i++) {
            assertThat(result.records().get(i).getTsMs()).isGreaterThan(result.records().get(i - 1).getTsMs());
        }
    }

    /**
     * Property: Every flagged outlier remembers its original value and is blanked under set_nan.
     */
    @Property(tries = 100)
    void outliersKeepOriginalValue(@ForAll("spikySeries") List<CanonicalRecord> input) {
        OutlierDetector detector = new OutlierDetector(new QualityProperties());

        OutlierDetector.Result result = detector.apply(input);

        long flagged = result.records().stream().filter(r -> r.getQualityFlags().isOutlier()).count();
        assertThat(flagged).isEqualTo(result.outlierCount());
        for (int i = 0; i < input.size(); i++) {
            CanonicalRecord row = result.records().get(i);
            if (row.getQualityFlags().isOutlier()) {
                assertThat(row.getQualityFlags().getOriginalValue()).isEqualTo(input.get(i).getValue());
                assertThat(row.hasFiniteValue()).isFalse();
                assertThat(row.getQualityFlags().isMissing()).isTrue();
            } else {
                assertThat(row.getValue()).isEqualTo(input.get(i).getValue());
            }
        }
    }

    @Provide
    Arbitrary<List<CanonicalRecord>> gappySeries() {
        Arbitrary<Long> steps = Arbitraries.frequencyOf(
                Tuple.of(8, Arbitraries.just(MINUTE_MS)),
                Tuple.of(1, Arbitraries.longs().between(2, 4).map(k -> k * MINUTE_MS)),
                Tuple.of(1, Arbitraries.longs().between(6, 30).map(k -> k * MINUTE_MS)));
        Arbitrary<Double> values = Arbitraries.frequencyOf(
                Tuple.of(9, Arbitraries.doubles().between(-500.0, 500.0)),
                Tuple.of(1, Arbitraries.just(Double.NaN)));
        return Combinators.combine(steps.list().ofMinSize(2).ofMaxSize(60), values.list().ofSize(61))
                .as(OutlierImputePropertyTest::build);
    }

    @Provide
    Arbitrary<List<CanonicalRecord>> spikySeries() {
        Arbitrary<Double> values = Arbitraries.frequencyOf(
                Tuple.of(19, Arbitraries.doubles().between(10.0, 12.0)),
                Tuple.of(1, Arbitraries.doubles().between(1_000.0, 5_000.0)));
        return values.list().ofMinSize(5).ofMaxSize(80).map(vs -> {
            List<CanonicalRecord> out = new ArrayList<>(vs.size());
            for (int i = 0; i < vs.size(); i++) {
                out.add(record(SourceType.AEF, "KAK", "Ez", T0 + i * MINUTE_MS, vs.get(i)));
            }
            return out;
        });
    }

    private static List<CanonicalRecord> build(List<Long> steps, List<Double> values) {
        List<CanonicalRecord> out = new ArrayList<>(steps.size() + 1);
        long ts = T0;
        out.add(record(SourceType.GEOMAG, "KAK", "X", ts, values.get(0)));
        for (int i = 0; i < steps.size(); i++) {
            ts += steps.get(i);
            out.add(record(SourceType.GEOMAG, "KAK", "X", ts, values.get(i + 1)));
        }
        return out;
    }
}
