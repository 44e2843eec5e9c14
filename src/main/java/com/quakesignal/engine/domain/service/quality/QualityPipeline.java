package com.quakesignal.engine.domain.service.quality;

import com.quakesignal.engine.domain.model.CanonicalRecord;
import com.quakesignal.engine.domain.model.FilterEffect;
import com.quakesignal.engine.domain.model.QualityFlags;
import com.quakesignal.engine.domain.model.QualityReport;
import com.quakesignal.engine.domain.model.QualityResult;
import com.quakesignal.engine.domain.model.SeriesKey;
import com.quakesignal.engine.domain.service.quality.denoise.DenoiseMethod;
import com.quakesignal.engine.domain.service.signal.RobustStats;
import com.quakesignal.engine.domain.service.spatial.StationRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class QualityPipeline {

    private final QualityProperties properties;
    private final SentinelFilter sentinelFilter;
    private final OutlierDetector outlierDetector;
    private final GapImputer gapImputer;
    private final SeriesStandardizer standardizer;

    public static QualityPipeline create(QualityProperties properties) {
        return new QualityPipeline(properties,
                new SentinelFilter(properties),
                new OutlierDetector(properties),
                new GapImputer(properties),
                new SeriesStandardizer(properties));
    }

    public QualityResult process(SeriesKey key, List<CanonicalRecord> series) {
        return process(key, series, StationRegistry.empty(), null);
    }

    public QualityResult process(SeriesKey key, List<CanonicalRecord> series,
                                 StationRegistry registry, String paramsHash) {
        List<CanonicalRecord> owned = new ArrayList<>();
        int foreign = 0;
        for (CanonicalRecord record : series) {
            if (record != null && record.getSource() != null && record.getStationId() != null
                    && record.getChannel() != null && !key.equals(record.seriesKey())) {
                foreign++;
                continue;
            }
            owned.add(record);
        }

        SentinelFilter.Result cleaned = sentinelFilter.apply(owned);
        QualityProperties.Denoise denoise = properties.denoiseFor(key.source());
        Denoised denoised = denoise(key, cleaned.records(), denoise);
        OutlierDetector.Result flagged = outlierDetector.apply(denoised.records());
        GapImputer.Result imputed = gapImputer.apply(flagged.records());
        List<CanonicalRecord> standardized = standardizer.apply(imputed.records(), registry, paramsHash);

        long missing = standardized.stream().filter(r -> !r.hasFiniteValue()).count();
        QualityReport report = QualityReport.builder()
                .seriesKey(key.toString())
                .inputRows(series.size())
                .outputRows(standardized.size())
                .droppedParseErrors(cleaned.droppedParseErrors() + foreign)
                .parseErrorPoints(cleaned.parseErrorPoints())
                .duplicatesCollapsed(cleaned.duplicatesCollapsed())
                .reordered(cleaned.reordered())
                .sentinelCount(cleaned.sentinelCount())
                .outlierCount(flagged.outlierCount())
                .interpolatedCount(imputed.interpolatedCount())
                .unfilledGapRuns(imputed.unfilledGapRuns())
                .insertedGapRows(imputed.insertedGapRows())
                .missingRate(standardized.isEmpty() ? 0.0 : (double) missing / standardized.size())
                .denoiseMethod(denoise.getMethod().key())
                .tsMin(standardized.isEmpty() ? null : standardized.get(0).getTsMs())
                .tsMax(standardized.isEmpty() ? null : standardized.get(standardized.size() - 1).getTsMs())
                .build();

        if (standardized.isEmpty()) {
            log.warn("[Quality] 정제 후 빈 시계열: series={}, input={}", key, series.size());
        } else {
            log.debug("[Quality] 시계열 정제 완료: series={}, rows={}, outliers={}, interpolated={}, missingRate={}",
                    key, standardized.size(), flagged.outlierCount(), imputed.interpolatedCount(),
                    String.format(Locale.ROOT, "%.4f", report.getMissingRate()));
        }
        return new QualityResult(key, standardized, report, denoised.effect());
    }

    private record Denoised(List<CanonicalRecord> records, FilterEffect effect) {
    }

    private Denoised denoise(SeriesKey key, List<CanonicalRecord> records, QualityProperties.Denoise config) {
        DenoiseMethod method = config.getMethod() != null ? config.getMethod() : DenoiseMethod.NONE;
        if (!method.isActive() || records.isEmpty()) {
            return new Denoised(records, null);
        }
        long[] ts = new long[records.size()];
        double[] values = new double[records.size()];
        for (int i = 0; i < records.size(); i++) {
            ts[i] = records.get(i).getTsMs();
            values[i] = records.get(i).getValue();
        }
        Map<String, Double> params = Collections.unmodifiableMap(method.effectiveParams(config.getParams()));
        double[] smoothed = method.apply(ts, values, params);

        List<CanonicalRecord> out = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            CanonicalRecord record = records.get(i);
            if (!record.hasFiniteValue()) {
                out.add(record);
                continue;
            }
            QualityFlags flags = record.getQualityFlags().toBuilder()
                    .filtered(true)
                    .filterType(method.key())
                    .filterParams(params)
                    .build();
            out.add(record.withValue(Double.isFinite(smoothed[i]) ? smoothed[i] : record.getValue(), flags));
        }
        FilterEffect effect = FilterEffect.builder()
                .seriesKey(key)
                .method(method.key())
                .params(new TreeMap<>(method.resolvedParams(values, params)))
                .rawStd(RobustStats.populationStd(RobustStats.finite(values)))
                .filteredStd(RobustStats.populationStd(RobustStats.finite(
                        out.stream().mapToDouble(CanonicalRecord::getValue).toArray())))
                .build();
        return new Denoised(out, effect);
    }
}
