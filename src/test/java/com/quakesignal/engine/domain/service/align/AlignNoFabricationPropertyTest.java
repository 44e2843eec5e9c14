package com.quakesignal.engine.domain.service.align;

import com.quakesignal.engine.domain.model.AlignedPoint;
import com.quakesignal.engine.domain.model.AlignedSeries;
import com.quakesignal.engine.domain.model.CanonicalRecord;
import com.quakesignal.engine.domain.model.SeriesKey;
import com.quakesignal.engine.domain.model.SourceType;
import net.jqwik.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static com.quakesignal.engine.support.Records.MINUTE_MS;
import static com.quakesignal.engine.support.Records.record;
import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for grid alignment.
 */
class AlignNoFabricationPropertyTest {

    private static final long T0 = 1_672_531_200_000L;
    private static final SeriesKey KEY = new SeriesKey(SourceType.GEOMAG, "KAK", "X");

    private final TimeAligner aligner = new TimeAligner();

    /**
     * Property: A coarse series never yields a present grid point without a real sample behind it.
     */
    @Property(tries = 100)
    void coarseSeriesNeverFabricatesGridPoints(@ForAll("coarseOffsets") Set<Integer> slots) {
        List<CanonicalRecord> input = new ArrayList<>();
        for (int slot : slots) {
            input.add(record(SourceType.GEOMAG, "KAK", "X", T0 + slot * 5 * MINUTE_MS, slot));
        }
        GridSpec grid = new GridSpec(T0, T0 + 6 * MINUTE_MS * 60, MINUTE_MS);

        AlignedSeries aligned = aligner.align(KEY, input, grid, SourcePolicy.strict(SourceType.GEOMAG));

        Set<Long> sampled = new TreeSet<>();
        input.forEach(r -> sampled.add(r.getTsMs()));
        for (AlignedPoint point : aligned.getPoints()) {
            if (point.isPresent()) {
                assertThat(sampled.contains(point.getTsMs()) || point.isInterpolated())
                        .as("grid point %d", point.getTsMs())
                        .isTrue();
            }
        }
        assertThat(aligned.presentCount()).isLessThanOrEqualTo(input.size());
    }

    @Provide
    Arbitrary<Set<Integer>> coarseOffsets() {
        return Arbitraries.integers().between(0, 72).set().ofMinSize(2).ofMaxSize(60);
    }
}
