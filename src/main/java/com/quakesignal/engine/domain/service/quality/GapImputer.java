package com.quakesignal.engine.domain.service.quality;

import com.quakesignal.engine.domain.model.CanonicalRecord;
import com.quakesignal.engine.domain.model.MissingReason;
import com.quakesignal.engine.domain.model.QualityFlags;
import com.quakesignal.engine.domain.service.signal.SamplingIntervals;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class GapImputer {

    static final int SPLINE_NEIGHBOURS = 3;

    private final QualityProperties properties;

    public Result apply(List<CanonicalRecord> records) {
        QualityProperties.Impute config = properties.getImpute();
        List<CanonicalRecord> rows = new ArrayList<>(records);
        int inserted = 0;
        if (config.isMaterializeGaps()) {
            inserted = materializeGaps(rows, config);
        }

        long maxGapMs = properties.maxGapMs();
        int filled = 0;
        int unfilledRuns = 0;
        int i = 0;
        while (i < rows.size()) {
            if (rows.get(i).hasFiniteValue()) {
                i++;
                continue;
            }
            int start = i;
            while (i < rows.size() && !rows.get(i).hasFiniteValue()) {
                i++;
            }
            int end = i - 1;
            int left = start - 1;
            int right = i < rows.size() ? i : -1;
            long gapMs = gapDuration(rows, start, end, left, right);

            if (left >= 0 && right >= 0 && gapMs <= maxGapMs) {
                fillRun(rows, start, end, left, right, gapMs, maxGapMs, config.getMethod());
                filled += end - start + 1;
            } else {
                markUnfilled(rows, start, end, gapMs, maxGapMs);
                unfilledRuns++;
            }
        }
        return new Result(rows, filled, unfilledRuns, inserted);
    }

    private int materializeGaps(List<CanonicalRecord> rows, QualityProperties.Impute config) {
        long[] ts = rows.stream().mapToLong(CanonicalRecord::getTsMs).toArray();
        long cadence = SamplingIntervals.medianIntervalMs(ts);
        if (cadence <= 0) return 0;

        List<CanonicalRecord> out = new ArrayList<>(rows.size());
        int inserted = 0;
        for (int i = 0; i < rows.size(); i++) {
            CanonicalRecord current = rows.get(i);
            if (i > 0) {
                CanonicalRecord previous = rows.get(i - 1);
                long dt = current.getTsMs() - previous.getTsMs();
                long missingSteps = (dt - 1) / cadence;
                if (dt > config.getGapFactor() * cadence) {
                    if (inserted + missingSteps > config.getMaxInsertedRows()) {
                        log.warn("[Quality] 결측 구간 행 삽입 상한 초과, 구간 유지: series={}, gapMs={}",
                                current.seriesKey(), dt);
                    } else {
                        for (long t = previous.getTsMs() + cadence; t < current.getTsMs(); t += cadence) {
                            out.add(previous.toBuilder()
                                    .tsMs(t)
                                    .value(Double.NaN)
                                    .qualityFlags(QualityFlags.missing(MissingReason.GAP))
                                    .build());
                            inserted++;
                        }
                    }
                }
            }
            out.add(current);
        }
        rows.clear();
        rows.addAll(out);
        return inserted;
    }

    private long gapDuration(List<CanonicalRecord> rows, int start, int end, int left, int right) {
        long from = left >= 0 ? rows.get(left).getTsMs() : rows.get(start).getTsMs();
        long to = right >= 0 ? rows.get(right).getTsMs() : rows.get(end).getTsMs();
        return to - from;
    }

    private void fillRun(List<CanonicalRecord> rows, int start, int end, int left, int right,
                         long gapMs, long maxGapMs, ImputeMethod method) {
        CanonicalRecord l = rows.get(left);
        CanonicalRecord r = rows.get(right);
        PolynomialSplineFunction spline = method == ImputeMethod.SPLINE ? localSpline(rows, left, right) : null;
        String appliedMethod = spline != null ? ImputeMethod.SPLINE.key() : ImputeMethod.LINEAR.key();

        for (int k = start; k <= end; k++) {
            CanonicalRecord row = rows.get(k);
            double value;
            if (spline != null) {
                value = spline.value((row.getTsMs() - l.getTsMs()) / 1000.0);
            } else {
                double fraction = (double) (row.getTsMs() - l.getTsMs()) / (r.getTsMs() - l.getTsMs());
                value = l.getValue() + (r.getValue() - l.getValue()) * fraction;
            }
            QualityFlags flags = row.getQualityFlags().toBuilder()
                    .missing(false)
                    .interpolated(true)
                    .interpMethod(appliedMethod)
                    .gapMs(gapMs)
                    .maxGapMs(maxGapMs)
                    .build();
            rows.set(k, row.withValue(value, flags));
        }
    }

    private PolynomialSplineFunction localSpline(List<CanonicalRecord> rows, int left, int right) {
        List<CanonicalRecord> knots = new ArrayList<>();
        for (int k = left, taken = 0; k >= 0 && taken < SPLINE_NEIGHBOURS; k--) {
            if (rows.get(k).hasFiniteValue()) {
                knots.add(0, rows.get(k));
                taken++;
            }
        }
        for (int k = right, taken = 0; k < rows.size() && taken < SPLINE_NEIGHBOURS; k++) {
            if (rows.get(k).hasFiniteValue()) {
                knots.add(rows.get(k));
                taken++;
            }
        }
        if (knots.size() < 3) return null;

        long origin = rows.get(left).getTsMs();
        double[] x = new double[knots.size()];
        double[] y = new double[knots.size()];
        for (int k = 0; k < knots.size(); k++) {
            x[k] = (knots.get(k).getTsMs() - origin) / 1000.0;
            y[k] = knots.get(k).getValue();
        }
        return new SplineInterpolator().interpolate(x, y);
    }

    private void markUnfilled(List<CanonicalRecord> rows, int start, int end, long gapMs, long maxGapMs) {
        for (int k = start; k <= end; k++) {
            CanonicalRecord row = rows.get(k);
            QualityFlags current = row.getQualityFlags();
            QualityFlags flags = current.toBuilder()
                    .missing(true)
                    .missingReason(current.getMissingReason() != null ? current.getMissingReason() : MissingReason.GAP)
                    .interpolated(false)
                    .gapMs(gapMs)
                    .maxGapMs(maxGapMs)
                    .build();
            rows.set(k, row.withValue(Double.NaN, flags));
        }
    }

    public record Result(List<CanonicalRecord> records, int interpolatedCount, int unfilledGapRuns, int insertedGapRows) {
    }
}
