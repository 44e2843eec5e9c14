package com.quakesignal.engine.domain.service.feature;

import com.quakesignal.engine.domain.model.AlignedSeries;
import com.quakesignal.engine.domain.model.Feature;
import com.quakesignal.engine.domain.model.FeatureSet;
import com.quakesignal.engine.domain.model.LinkedDataset;
import com.quakesignal.engine.domain.model.SourceType;
import com.quakesignal.engine.domain.model.WaveformMetric;
import com.quakesignal.engine.domain.service.signal.RobustStats;
import com.quakesignal.engine.domain.service.signal.Spectrum;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Slf4j
@Component
@RequiredArgsConstructor
public class FeatureExtractor {

    static final double SECONDS_PER_HOUR = 3600.0;

    private final FeatureProperties properties;

    public FeatureSet extract(LinkedDataset dataset, String stationId, SourceType source) {
        return extract(dataset.getEvent().eventId(), stationId, source, dataset.seriesFor(stationId, source));
    }

    public FeatureSet extract(String eventId, String stationId, SourceType source, List<AlignedSeries> series) {
        Map<String, Double> values = new TreeMap<>();
        Map<String, Double> nanRatios = new TreeMap<>();

        long totalPoints = 0;
        long missingPoints = 0;
        Map<String, AlignedSeries> derivedByChannel = new LinkedHashMap<>();

        for (AlignedSeries s : series) {
            String channel = s.getKey().channel();
            double[] v = s.values();
            long[] ts = s.timestamps();
            double nanFraction = RobustStats.nanFraction(v);
            totalPoints += v.length;
            missingPoints += Math.round(nanFraction * v.length);

            put(values, nanRatios, channel + ":missing_rate", nanFraction, nanFraction);
            if (source == SourceType.SEISMIC && WaveformMetric.isDerived(channel)) {
                derivedByChannel.put(channel, s);
            }
            if (nanFraction > properties.getMaxNanFraction()) {
                log.debug("[Feature] 결측 비율 초과로 특성 생략: event={}, series={}, nanFraction={}",
                        eventId, s.getKey(), nanFraction);
                continue;
            }

            Map<String, Double> computed = new LinkedHashMap<>(generic(v));
            switch (source) {
                case GEOMAG -> computed.putAll(geomag(ts, v));
                case VLF, AEF -> computed.putAll(spectral(ts, v, properties.bandFor(source)));
                case SEISMIC -> {
                    if (!WaveformMetric.isDerived(channel)) {
                        computed.putAll(seismicEnvelope(ts, v));
                    }
                }
            }
            computed.forEach((name, value) -> put(values, nanRatios, channel + ":" + name, value, nanFraction));
        }

        if (source == SourceType.SEISMIC) {
            seismicDerived(derivedByChannel).forEach((name, entry) ->
                    put(values, nanRatios, name, entry[0], entry[1]));
        }

        List<Feature> features = new ArrayList<>(values.size());
        values.forEach((name, value) -> features.add(Feature.builder()
                .eventId(eventId)
                .stationId(stationId)
                .source(source)
                .featureName(name)
                .value(value)
                .nanRatio(nanRatios.get(name))
                .build()));

        return FeatureSet.builder()
                .eventId(eventId)
                .stationId(stationId)
                .source(source)
                .features(features)
                .missingRate(totalPoints == 0 ? 1.0 : (double) missingPoints / totalPoints)
                .build();
    }

    public static boolean isTimeAnchored(String featureName) {
        return featureName.endsWith(":onset_ts_ms");
    }

    private void put(Map<String, Double> values, Map<String, Double> nanRatios, String name, double value, double nanRatio) {
        if (!Double.isFinite(value)) return;
        values.put(name, value);
        nanRatios.put(name, nanRatio);
    }

    Map<String, Double> generic(double[] values) {
        double[] finite = RobustStats.finite(values);
        Map<String, Double> out = new LinkedHashMap<>();
        if (finite.length == 0) return out;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : finite) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        out.put("mean", RobustStats.mean(finite));
        out.put("std", RobustStats.populationStd(finite));
        out.put("min", min);
        out.put("max", max);
        out.put("ptp", max - min);
        return out;
    }

    Map<String, Double> geomag(long[] ts, double[] values) {
        Map<String, Double> out = new LinkedHashMap<>();
        double rateSum = 0.0;
        int pairs = 0;
        int abrupt = 0;
        for (int i = 1; i < values.length; i++) {
            if (!Double.isFinite(values[i]) || !Double.isFinite(values[i - 1])) continue;
            double delta = values[i] - values[i - 1];
            double seconds = (ts[i] - ts[i - 1]) / 1000.0;
            if (seconds > 0) {
                rateSum += Math.abs(delta) / seconds;
                pairs++;
            }
            if (Math.abs(delta) > properties.getAbruptChangeThreshold()) {
                abrupt++;
            }
        }
        if (pairs > 0) {
            out.put("gradient_rate", rateSum / pairs);
        }
        out.put("abrupt_change_count", (double) abrupt);

        int window = properties.getShortWindowPoints();
        double maxVariance = Double.NaN;
        for (int start = 0; start + window <= values.length; start += window) {
            double[] chunk = new double[window];
            System.arraycopy(values, start, chunk, 0, window);
            double[] finite = RobustStats.finite(chunk);
            if (finite.length * 2 < window) continue;
            double variance = RobustStats.populationVariance(finite);
            maxVariance = Double.isNaN(maxVariance) ? variance : Math.max(maxVariance, variance);
        }
        out.put("short_window_variance", maxVariance);
        return out;
    }

    Map<String, Double> spectral(long[] ts, double[] values, FeatureProperties.Band band) {
        Map<String, Double> out = new LinkedHashMap<>();
        double sampleRate = gridSampleRate(ts);
        double[] finite = RobustStats.finite(values);
        if (sampleRate <= 0 || finite.length < 2) return out;

        Spectrum spectrum = Spectrum.ofCentered(values, sampleRate);
        out.put("band_power", spectrum.bandPower(band.getLowHz(), band.getHighHz()));
        out.put("peak_freq_hz", spectrum.peakFrequency());
        out.put("peak_amplitude", spectrum.peakAmplitude());

        SimpleRegression drift = new SimpleRegression();
        for (int i = 0; i < values.length; i++) {
            if (Double.isFinite(values[i])) {
                drift.addData((ts[i] - ts[0]) / 1000.0, values[i]);
            }
        }
        out.put("drift_rate_per_hour", drift.getSlope() * SECONDS_PER_HOUR);
        return out;
    }

    Map<String, Double> seismicEnvelope(long[] ts, double[] values) {
        Map<String, Double> out = new LinkedHashMap<>();
        double[] finite = RobustStats.finite(values);
        if (finite.length == 0) return out;
        double sumSquares = 0.0;
        for (double v : finite) {
            sumSquares += v * v;
        }
        out.put("rms", Math.sqrt(sumSquares / finite.length));
        out.put("energy", sumSquares);
        double sampleRate = gridSampleRate(ts);
        if (sampleRate > 0) {
            out.put("dominant_freq_hz", Spectrum.ofCentered(values, sampleRate).peakFrequency());
        }
        StaLtaTrigger.Detection detection = StaLtaTrigger.from(properties.getStaLta()).detect(ts, values);
        out.put("sta_lta_max", detection.maxRatio());
        if (detection.hasOnset()) {
            out.put("onset_ts_ms", detection.onsetTsMs().doubleValue());
        }
        return out;
    }

    Map<String, double[]> seismicDerived(Map<String, AlignedSeries> derivedByChannel) {
        Map<String, Map<WaveformMetric, AlignedSeries>> byRawChannel = new TreeMap<>();
        derivedByChannel.forEach((channel, series) -> {
            WaveformMetric metric = WaveformMetric.ofChannel(channel);
            String raw = channel.substring(0, channel.length() - metric.suffix().length() - 1);
            byRawChannel.computeIfAbsent(raw, k -> new LinkedHashMap<>()).put(metric, series);
        });

        Map<String, double[]> out = new LinkedHashMap<>();
        byRawChannel.forEach((raw, metrics) -> {
            AlignedSeries rms = metrics.get(WaveformMetric.RMS);
            AlignedSeries energy = metrics.get(WaveformMetric.ENERGY);
            AlignedSeries peakFreq = metrics.get(WaveformMetric.PEAK_FREQ);

            if (rms != null) {
                double[] envelope = rms.values();
                double nanFraction = RobustStats.nanFraction(envelope);
                if (nanFraction <= properties.getMaxNanFraction()) {
                    double[] finite = RobustStats.finite(envelope);
                    double sumSquares = 0.0;
                    for (double v : finite) {
                        sumSquares += v * v;
                    }
                    out.put(raw + ":rms", new double[]{Math.sqrt(sumSquares / finite.length), nanFraction});
                    StaLtaTrigger.Detection detection = StaLtaTrigger.from(properties.getStaLta())
                            .detect(rms.timestamps(), envelope);
                    out.put(raw + ":sta_lta_max", new double[]{detection.maxRatio(), nanFraction});
                    if (detection.hasOnset()) {
                        out.put(raw + ":onset_ts_ms", new double[]{detection.onsetTsMs().doubleValue(), nanFraction});
                    }
                }
            }
            if (energy != null) {
                double[] e = energy.values();
                double nanFraction = RobustStats.nanFraction(e);
                if (nanFraction <= properties.getMaxNanFraction()) {
                    double total = 0.0;
                    int peakIndex = -1;
                    for (int i = 0; i < e.length; i++) {
                        if (!Double.isFinite(e[i])) continue;
                        total += e[i];
                        if (peakIndex < 0 || e[i] > e[peakIndex]) peakIndex = i;
                    }
                    out.put(raw + ":energy", new double[]{total, nanFraction});
                    if (peakFreq != null && peakIndex >= 0) {
                        double dominant = peakFreq.values()[peakIndex];
                        out.put(raw + ":dominant_freq_hz", new double[]{dominant, nanFraction});
                    }
                }
            }
        });
        return out;
    }

    private double gridSampleRate(long[] ts) {
        if (ts.length < 2) return 0.0;
        long step = ts[1] - ts[0];
        return step > 0 ? 1000.0 / step : 0.0;
    }
}
