package com.quakesignal.engine.domain.service.feature;

import com.quakesignal.engine.domain.model.AlignMethod;
import com.quakesignal.engine.domain.model.AlignedPoint;
import com.quakesignal.engine.domain.model.AlignedSeries;
import com.quakesignal.engine.domain.model.CatalogEvent;
import com.quakesignal.engine.domain.model.FeatureSet;
import com.quakesignal.engine.domain.model.LinkedDataset;
import com.quakesignal.engine.domain.model.SeriesKey;
import com.quakesignal.engine.domain.model.SourceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.IntToDoubleFunction;

import static com.quakesignal.engine.support.Records.MINUTE_MS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

class FeatureExtractorTest {

    private static final long T0 = 1_672_531_200_000L;
    private static final CatalogEvent EVENT = new CatalogEvent("E1", Instant.ofEpochMilli(T0), 35.0, 139.0, 10.0, 5.1);

    private FeatureProperties properties;
    private FeatureExtractor extractor;

    @BeforeEach
    void setUp() {
        properties = new FeatureProperties();
        extractor = new FeatureExtractor(properties);
    }

    @Test
    void geomagFeaturesIncludeGenericStatsAndAbruptChanges() {
        SeriesKey key = new SeriesKey(SourceType.GEOMAG, "KAK", "X");
        LinkedDataset dataset = dataset(aligned(key, 40, i -> i < 15 ? 100.0 : 130.0));

        FeatureSet set = extractor.extract(dataset, "KAK", SourceType.GEOMAG);
        Map<String, Double> features = set.asMap();

        assertThat(features.get("X:mean")).isCloseTo(118.75, offset(1e-9));
        assertThat(features.get("X:min")).isEqualTo(100.0);
        assertThat(features.get("X:max")).isEqualTo(130.0);
        assertThat(features.get("X:ptp")).isEqualTo(30.0);
        assertThat(features.get("X:std")).isCloseTo(30.0 * Math.sqrt(0.375 * 0.625), offset(1e-9));
        assertThat(features.get("X:abrupt_change_count")).isEqualTo(1.0);
        assertThat(features.get("X:gradient_rate")).isCloseTo(30.0 / 60.0 / 39.0, offset(1e-12));
        assertThat(features.get("X:short_window_variance")).isCloseTo(225.0, offset(1e-9));
        assertThat(features.get("X:missing_rate")).isZero();
        assertThat(set.getMissingRate()).isZero();
        assertThat(set.getFeatures()).allSatisfy(f -> {
            assertThat(f.getEventId()).isEqualTo("E1");
            assertThat(f.getStationId()).isEqualTo("KAK");
        });
    }

    @Test
    void featuresAreOmittedAboveNanFractionButMissingRateIsKept() {
        SeriesKey key = new SeriesKey(SourceType.GEOMAG, "KAK", "Y");
        LinkedDataset dataset = dataset(aligned(key, 10, i -> i < 3 ? 5.0 : Double.NaN));

        FeatureSet set = extractor.extract(dataset, "KAK", SourceType.GEOMAG);

        assertThat(set.asMap()).containsOnlyKeys("Y:missing_rate");
        assertThat(set.asMap().get("Y:missing_rate")).isCloseTo(0.7, offset(1e-12));
        assertThat(set.getMissingRate()).isCloseTo(0.7, offset(1e-12));
    }

    @Test
    void spectralSourcesReportPeakFrequencyAndDrift() {
        SeriesKey key = new SeriesKey(SourceType.VLF, "KAK", "amp");
        LinkedDataset dataset = dataset(aligned(key, 64,
                i -> 2.0 * i / 60.0 + Math.cos(2.0 * Math.PI * i / 16.0)));
        properties.getBands().get("vlf").setLowHz(0.0005);
        properties.getBands().get("vlf").setHighHz(0.002);

        Map<String, Double> features = extractor.extract(dataset, "KAK", SourceType.VLF).asMap();

        assertThat(features).containsKeys("amp:band_power", "amp:peak_amplitude", "amp:mean");
        assertThat(features.get("amp:band_power")).isPositive();
        assertThat(features.get("amp:drift_rate_per_hour")).isCloseTo(2.0, offset(0.2));
    }

    @Test
    void seismicWindowMetricsCollapseToPerChannelFeatures() {
        LinkedDataset dataset = dataset(
                aligned(new SeriesKey(SourceType.SEISMIC, "KAK", "BHZ.rms"), 40, i -> i == 35 ? 5.0 : 0.1),
                aligned(new SeriesKey(SourceType.SEISMIC, "KAK", "BHZ.energy"), 40, i -> i == 35 ? 900.0 : 1.0),
                aligned(new SeriesKey(SourceType.SEISMIC, "KAK", "BHZ.peak_freq"), 40, i -> i == 35 ? 2.5 : 0.3));

        Map<String, Double> features = extractor.extract(dataset, "KAK", SourceType.SEISMIC).asMap();

        assertThat(features.get("BHZ:energy")).isCloseTo(39.0 + 900.0, offset(1e-9));
        assertThat(features.get("BHZ:dominant_freq_hz")).isEqualTo(2.5);
        assertThat(features.get("BHZ:rms")).isPositive();
        assertThat(features.get("BHZ:sta_lta_max")).isGreaterThan(3.0);
        assertThat(features).containsKey("BHZ.rms:mean");
    }

    @Test
    void rawWaveformDominantFrequencyIgnoresOffset() {
        long[] ts = new long[600];
        double[] values = new double[600];
        for (int i = 0; i < ts.length; i++) {
            ts[i] = T0 + i * 100L;
            values[i] = 50.0 + 10.0 * Math.sin(2 * Math.PI * 2.0 * i / 10.0);
        }

        Map<String, Double> envelope = extractor.seismicEnvelope(ts, values);

        assertThat(envelope.get("dominant_freq_hz")).isCloseTo(2.0, offset(0.05));
    }

    @Test
    void stationWithoutSeriesYieldsFullMissingRate() {
        FeatureSet set = extractor.extract(dataset(), "KAK", SourceType.AEF);

        assertThat(set.getFeatures()).isEmpty();
        assertThat(set.getMissingRate()).isEqualTo(1.0);
    }

    private static AlignedSeries aligned(SeriesKey key, int count, IntToDoubleFunction value) {
        List<AlignedPoint> points = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            double v = value.applyAsDouble(i);
            long ts = T0 + i * MINUTE_MS;
            points.add(Double.isFinite(v)
                    ? AlignedPoint.builder().tsMs(ts).value(v).sampleCount(1).build()
                    : AlignedPoint.missingAt(ts));
        }
        return AlignedSeries.builder()
                .key(key)
                .method(AlignMethod.REINDEX)
                .nativeIntervalMs(MINUTE_MS)
                .points(points)
                .build();
    }

    private static LinkedDataset dataset(AlignedSeries... series) {
        SortedMap<SeriesKey, AlignedSeries> map = new TreeMap<>();
        for (AlignedSeries s : series) {
            map.put(s.getKey(), s);
        }
        return LinkedDataset.builder()
                .event(EVENT)
                .stations(List.of())
                .series(map)
                .rows(List.of())
                .build();
    }
}
