package com.quakesignal.engine.domain.service.align;

import com.quakesignal.engine.domain.exception.InvalidConfigurationException;
import com.quakesignal.engine.domain.model.AlignMethod;
import com.quakesignal.engine.domain.model.AlignedPoint;
import com.quakesignal.engine.domain.model.AlignedSeries;
import com.quakesignal.engine.domain.model.CanonicalRecord;
import com.quakesignal.engine.domain.model.SeriesKey;
import com.quakesignal.engine.domain.model.SourceType;
import com.quakesignal.engine.domain.model.WaveformMetric;
import com.quakesignal.engine.domain.service.signal.SamplingIntervals;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Slf4j
@Component
public class TimeAligner {

    static final String FORWARD_FILL = "ffill";
    static final String QUALITY_IMPUTED = "imputed";

    public AlignedSeries align(SeriesKey key, List<CanonicalRecord> series, GridSpec grid, SourcePolicy policy) {
        if (policy.forwardFill() && key.source().isSpectralDestined()) {
            throw new InvalidConfigurationException("forward fill requested for spectral series " + key);
        }

        List<CanonicalRecord> ordered = new ArrayList<>(series);
        ordered.sort(Comparator.comparingLong(CanonicalRecord::getTsMs));
        long[] ts = ordered.stream().mapToLong(CanonicalRecord::getTsMs).toArray();
        long nativeInterval = SamplingIntervals.medianIntervalMs(ts);

        if (isRawWaveform(key, nativeInterval, policy)) {
            throw new IllegalArgumentException("raw waveform " + key + " (interval " + nativeInterval
                    + "ms) must be reduced to window features before alignment");
        }

        AlignMethod method = nativeInterval > 0 && nativeInterval < grid.stepMs()
                ? AlignMethod.AGGREGATE
                : AlignMethod.REINDEX;
        List<AlignedPoint> points = method == AlignMethod.AGGREGATE
                ? aggregate(ordered, grid)
                : reindex(ordered, grid, policy.reindexToleranceMs());

        if (policy.forwardFill()) {
            points = forwardFill(points, policy.forwardFillLimit());
        }

        log.debug("[Align] 정렬 완료: series={}, method={}, native={}ms, grid={}",
                key, method, nativeInterval, grid.size());
        return AlignedSeries.builder()
                .key(key)
                .method(method)
                .nativeIntervalMs(nativeInterval)
                .points(points)
                .build();
    }

    public boolean isRawWaveform(SeriesKey key, long nativeIntervalMs, SourcePolicy policy) {
        return key.source() == SourceType.SEISMIC
                && nativeIntervalMs > 0
                && nativeIntervalMs < policy.rawWaveformIntervalMs()
                && !WaveformMetric.isDerived(key.channel());
    }

    private List<AlignedPoint> aggregate(List<CanonicalRecord> ordered, GridSpec grid) {
        int size = grid.size();
        List<List<CanonicalRecord>> buckets = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            buckets.add(new ArrayList<>());
        }
        for (CanonicalRecord record : ordered) {
            if (!record.hasFiniteValue()) continue;
            int bucket = grid.bucketOf(record.getTsMs());
            if (bucket >= 0 && bucket < size) {
                buckets.get(bucket).add(record);
            }
        }

        List<AlignedPoint> points = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            points.add(summarize(grid.timestampAt(i), buckets.get(i)));
        }
        return points;
    }

    private AlignedPoint summarize(long gridTs, List<CanonicalRecord> bucket) {
        if (bucket.isEmpty()) {
            return AlignedPoint.missingAt(gridTs);
        }
        int n = bucket.size();
        double sum = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        int real = 0;
        for (CanonicalRecord record : bucket) {
            double v = record.getValue();
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
            if (!record.getQualityFlags().isInterpolated()) real++;
        }
        double mean = sum / n;
        double squares = 0.0;
        for (CanonicalRecord record : bucket) {
            double d = record.getValue() - mean;
            squares += d * d;
        }

        CanonicalRecord first = bucket.get(0);
        CanonicalRecord last = bucket.get(n - 1);
        long spanMs = last.getTsMs() - first.getTsMs();
        double gradient = n >= 2 && spanMs > 0
                ? (last.getValue() - first.getValue()) / (spanMs / 1000.0)
                : Double.NaN;

        return AlignedPoint.builder()
                .tsMs(gridTs)
                .value(mean)
                .std(Math.sqrt(squares / n))
                .min(min)
                .max(max)
                .peakToPeak(max - min)
                .gradient(gradient)
                .sampleCount(n)
                .missing(false)
                .interpolated(real == 0)
                .interpMethod(real == 0 ? QUALITY_IMPUTED : null)
                .build();
    }

    private List<AlignedPoint> reindex(List<CanonicalRecord> ordered, GridSpec grid, long toleranceMs) {
        TreeMap<Long, CanonicalRecord> byTs = new TreeMap<>();
        for (CanonicalRecord record : ordered) {
            byTs.put(record.getTsMs(), record);
        }

        List<AlignedPoint> points = new ArrayList<>(grid.size());
        for (int i = 0; i < grid.size(); i++) {
            long g = grid.timestampAt(i);
            CanonicalRecord match = nearest(byTs, g, toleranceMs);
            if (match == null || !match.hasFiniteValue()) {
                points.add(AlignedPoint.missingAt(g));
                continue;
            }
            boolean imputed = match.getQualityFlags().isInterpolated();
            points.add(AlignedPoint.builder()
                    .tsMs(g)
                    .value(match.getValue())
                    .min(match.getValue())
                    .max(match.getValue())
                    .peakToPeak(0.0)
                    .sampleCount(1)
                    .missing(false)
                    .interpolated(imputed)
                    .interpMethod(imputed ? match.getQualityFlags().getInterpMethod() : null)
                    .build());
        }
        return points;
    }

    private CanonicalRecord nearest(TreeMap<Long, CanonicalRecord> byTs, long g, long toleranceMs) {
        CanonicalRecord exact = byTs.get(g);
        if (exact != null || toleranceMs <= 0) {
            return exact;
        }
        Map.Entry<Long, CanonicalRecord> floor = byTs.floorEntry(g);
        Map.Entry<Long, CanonicalRecord> ceiling = byTs.ceilingEntry(g);
        long floorDistance = floor != null ? g - floor.getKey() : Long.MAX_VALUE;
        long ceilingDistance = ceiling != null ? ceiling.getKey() - g : Long.MAX_VALUE;
        if (Math.min(floorDistance, ceilingDistance) > toleranceMs) {
            return null;
        }
        return floorDistance <= ceilingDistance ? floor.getValue() : ceiling.getValue();
    }

    private List<AlignedPoint> forwardFill(List<AlignedPoint> points, int limit) {
        List<AlignedPoint> out = new ArrayList<>(points.size());
        AlignedPoint lastPresent = null;
        int carried = 0;
        for (AlignedPoint point : points) {
            if (point.isPresent()) {
                lastPresent = point;
                carried = 0;
                out.add(point);
                continue;
            }
            if (lastPresent != null && carried < limit) {
                carried++;
                out.add(AlignedPoint.builder()
                        .tsMs(point.getTsMs())
                        .value(lastPresent.getValue())
                        .sampleCount(0)
                        .missing(false)
                        .interpolated(true)
                        .interpMethod(FORWARD_FILL)
                        .build());
            } else {
                out.add(point);
            }
        }
        return out;
    }
}
