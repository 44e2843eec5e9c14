package com.quakesignal.engine.domain.service.baseline;

import com.quakesignal.engine.domain.model.AnomalyScore;
import com.quakesignal.engine.domain.model.BaselineWindow;
import com.quakesignal.engine.domain.model.CanonicalRecord;
import com.quakesignal.engine.domain.model.PartitionKey;
import com.quakesignal.engine.domain.model.SeriesKey;
import com.quakesignal.engine.domain.model.SourceType;
import com.quakesignal.engine.domain.service.align.AlignProperties;
import com.quakesignal.engine.domain.service.feature.WaveformWindowReducer;
import com.quakesignal.engine.domain.service.link.LinkProperties;
import com.quakesignal.engine.infra.store.InMemoryStandardizedStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static com.quakesignal.engine.support.Records.HOUR_MS;
import static com.quakesignal.engine.support.Records.MINUTE_MS;
import static com.quakesignal.engine.support.Records.at;
import static com.quakesignal.engine.support.Records.series;
import static org.assertj.core.api.Assertions.assertThat;

class StoreHistoryAccessorTest {

    private static final long T0 = at("2023-01-01T00:00:00Z");

    private InMemoryStandardizedStore store;
    private StoreHistoryAccessor accessor;

    @BeforeEach
    void setUp() {
        store = new InMemoryStandardizedStore();
        accessor = new StoreHistoryAccessor(store, new WaveformWindowReducer(), new AlignProperties());
    }

    @Test
    void fetchReturnsOnlyTheRequestedChannelWithinRange() {
        List<CanonicalRecord> rows = new ArrayList<>(series(SourceType.GEOMAG, "KAK", "X", T0, MINUTE_MS, 10, i -> i));
        rows.addAll(series(SourceType.GEOMAG, "KAK", "Y", T0, MINUTE_MS, 10, i -> -i));
        store.writePartition(new PartitionKey(SourceType.GEOMAG, "KAK", PartitionKey.utcDate(T0)), rows);

        List<CanonicalRecord> fetched = accessor.fetch(new SeriesKey(SourceType.GEOMAG, "KAK", "X"),
                T0 + 2 * MINUTE_MS, T0 + 5 * MINUTE_MS);

        assertThat(fetched).extracting(CanonicalRecord::getValue).containsExactly(2.0, 3.0, 4.0, 5.0);
        assertThat(fetched).allSatisfy(r -> assertThat(r.getChannel()).isEqualTo("X"));
    }

    @Test
    void derivedSeismicHistoryIsRebuiltFromRawWaveform() {
        List<CanonicalRecord> raw = series(SourceType.SEISMIC, "KAK", "BHZ", T0, 50L, 2_400, i -> 2.0);
        store.writePartition(new PartitionKey(SourceType.SEISMIC, "KAK", PartitionKey.utcDate(T0)), raw);

        List<CanonicalRecord> rms = accessor.fetch(new SeriesKey(SourceType.SEISMIC, "KAK", "BHZ.rms"),
                T0 - MINUTE_MS, T0 + 5 * MINUTE_MS);

        assertThat(rms).extracting(CanonicalRecord::getTsMs).containsExactly(T0, T0 + MINUTE_MS);
        assertThat(rms).extracting(CanonicalRecord::getValue).containsExactly(2.0, 2.0);
    }

    @Test
    void fastSeriesIsReducedToGridStepMeans() {
        List<CanonicalRecord> oneHertz = series(SourceType.GEOMAG, "KAK", "X", T0, 1_000L, 180, i -> i < 60 ? 1.0 : 3.0);
        store.writePartition(new PartitionKey(SourceType.GEOMAG, "KAK", PartitionKey.utcDate(T0)), oneHertz);

        List<CanonicalRecord> fetched = accessor.fetch(new SeriesKey(SourceType.GEOMAG, "KAK", "X"),
                T0, T0 + 3 * MINUTE_MS);

        assertThat(fetched).extracting(CanonicalRecord::getTsMs)
                .containsExactly(T0, T0 + MINUTE_MS, T0 + 2 * MINUTE_MS);
        assertThat(fetched).extracting(CanonicalRecord::getValue).containsExactly(1.0, 3.0, 3.0);
    }

    @Test
    void oneSigmaShiftOfOneHertzSeriesScoresAsAnomalyAgainstMinuteBaseline() {
        // Given: three hours of unit-variance 1 Hz noise ending well before the gap
        Random noise = new Random(7);
        long historyStart = T0 - 10 * HOUR_MS;
        List<CanonicalRecord> history = series(SourceType.GEOMAG, "KAK", "X", historyStart, 1_000L, 10_800,
                i -> noise.nextGaussian());
        store.writePartition(new PartitionKey(SourceType.GEOMAG, "KAK", PartitionKey.utcDate(historyStart)), history);

        BaselineProperties properties = new BaselineProperties();
        properties.setMinSamples(100);
        BaselineSelector selector = new BaselineSelector(properties, new LinkProperties());
        BaselineScorer scorer = new BaselineScorer(properties, selector, new ScoreAggregator(properties));
        SeriesKey key = new SeriesKey(SourceType.GEOMAG, "KAK", "X");

        // When: the event minute mean sits one native sigma above the history
        BaselineWindow window = selector.select(key, T0, accessor);
        AnomalyScore score = scorer.score("E1", "KAK", SourceType.GEOMAG, "X", T0, 1.0, window, "h");

        // Then
        assertThat(window.getSampleCount()).isEqualTo(180);
        assertThat(window.getScale()).isLessThan(0.3);
        assertThat(score.getScore()).isGreaterThan(0.95);
        assertThat(score.isAnomaly()).isTrue();
    }

    @Test
    void invertedRangeYieldsNothing() {
        assertThat(accessor.fetch(new SeriesKey(SourceType.AEF, "KAK", "Ez"), T0, T0 - 1)).isEmpty();
    }
}
