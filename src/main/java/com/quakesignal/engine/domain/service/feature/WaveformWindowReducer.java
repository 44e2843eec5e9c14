package com.quakesignal.engine.domain.service.feature;

import com.quakesignal.engine.domain.model.CanonicalRecord;
import com.quakesignal.engine.domain.model.QualityFlags;
import com.quakesignal.engine.domain.model.WaveformMetric;
import com.quakesignal.engine.domain.service.signal.SamplingIntervals;
import com.quakesignal.engine.domain.service.signal.Spectrum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class WaveformWindowReducer {

    public List<CanonicalRecord> reduce(List<CanonicalRecord> waveform, long windowMs) {
        if (waveform.isEmpty() || windowMs <= 0) return List.of();

        List<CanonicalRecord> ordered = new ArrayList<>(waveform);
        ordered.sort(Comparator.comparingLong(CanonicalRecord::getTsMs));
        long[] ts = ordered.stream().mapToLong(CanonicalRecord::getTsMs).toArray();
        double sampleRate = SamplingIntervals.sampleRateHz(ts);
        if (sampleRate <= 0) return List.of();
        int samplesPerWindow = (int) Math.round(sampleRate * windowMs / 1000.0);
        if (samplesPerWindow <= 0) return List.of();

        long firstWindow = Math.floorDiv(ts[0] + windowMs - 1, windowMs) * windowMs;
        List<CanonicalRecord> derived = new ArrayList<>();
        int i = 0;
        while (i < ordered.size() && ordered.get(i).getTsMs() < firstWindow) {
            i++;
        }
        while (i < ordered.size()) {
            long windowStart = firstWindow + Math.floorDiv(ordered.get(i).getTsMs() - firstWindow, windowMs) * windowMs;
            long windowEnd = windowStart + windowMs;
            int start = i;
            while (i < ordered.size() && ordered.get(i).getTsMs() < windowEnd) {
                i++;
            }
            if (i - start < samplesPerWindow) continue;
            List<CanonicalRecord> window = ordered.subList(start, start + samplesPerWindow);
            Map<WaveformMetric, Double> metrics = reduceWindow(window, sampleRate);
            if (metrics.isEmpty()) continue;
            CanonicalRecord template = window.get(0);
            metrics.forEach((metric, value) -> derived.add(derivedRecord(template, windowStart, metric, value)));
        }

        log.debug("[Feature] 파형 윈도우 축약: series={}, samples={}, windows={}",
                ordered.get(0).seriesKey(), ordered.size(), derived.size() / WaveformMetric.values().length);
        return derived;
    }

    Map<WaveformMetric, Double> reduceWindow(List<CanonicalRecord> window, double sampleRate) {
        double[] values = new double[window.size()];
        double sumSquares = 0.0;
        double peak = 0.0;
        int finite = 0;
        for (int k = 0; k < window.size(); k++) {
            double v = window.get(k).getValue();
            values[k] = v;
            if (!Double.isFinite(v)) continue;
            sumSquares += v * v;
            peak = Math.max(peak, Math.abs(v));
            finite++;
        }
        Map<WaveformMetric, Double> metrics = new EnumMap<>(WaveformMetric.class);
        if (finite == 0) return metrics;

        metrics.put(WaveformMetric.RMS, Math.sqrt(sumSquares / finite));
        metrics.put(WaveformMetric.ENERGY, sumSquares);
        metrics.put(WaveformMetric.PEAK_ABS, peak);
        metrics.put(WaveformMetric.PEAK_FREQ, Spectrum.ofCentered(values, sampleRate).peakFrequency());
        return metrics;
    }

    private CanonicalRecord derivedRecord(CanonicalRecord template, long windowStart, WaveformMetric metric, double value) {
        QualityFlags flags = QualityFlags.builder()
                .stationMatch(template.getQualityFlags().getStationMatch())
                .build();
        return template.toBuilder()
                .tsMs(windowStart)
                .channel(metric.channelFor(template.getChannel()))
                .value(value)
                .units(unitsFor(metric, template.getUnits()))
                .qualityFlags(flags)
                .build();
    }

    private String unitsFor(WaveformMetric metric, String rawUnits) {
        String base = rawUnits != null ? rawUnits : "counts";
        return switch (metric) {
            case RMS, PEAK_ABS -> base;
            case ENERGY -> base + "^2";
            case PEAK_FREQ -> "Hz";
        };
    }
}
