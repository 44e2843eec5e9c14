package com.quakesignal.engine.domain.service.quality;

import com.quakesignal.engine.domain.model.CanonicalRecord;
import com.quakesignal.engine.domain.model.MissingReason;
import com.quakesignal.engine.domain.model.QualityFlags;
import com.quakesignal.engine.domain.service.signal.RobustStats;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@RequiredArgsConstructor
public class OutlierDetector {

    static final int MIN_POINTS = 3;

    private final QualityProperties properties;

    public Result apply(List<CanonicalRecord> records) {
        QualityProperties.Outlier config = properties.getOutlier();
        double[] finite = records.stream()
                .filter(CanonicalRecord::hasFiniteValue)
                .mapToDouble(CanonicalRecord::getValue)
                .toArray();
        if (finite.length < MIN_POINTS) {
            return new Result(records, 0);
        }

        double center;
        double scale;
        if (config.getMethod() == OutlierMethod.ZSCORE) {
            center = RobustStats.mean(finite);
            scale = RobustStats.populationStd(finite);
        } else {
            center = RobustStats.median(finite);
            scale = RobustStats.robustScale(finite, center);
        }
        if (!(scale > 0) || !Double.isFinite(scale)) {
            return new Result(records, 0);
        }

        double threshold = config.getThreshold();
        double lower = center - threshold * scale;
        double upper = center + threshold * scale;
        List<CanonicalRecord> out = new ArrayList<>(records.size());
        int outliers = 0;

        for (CanonicalRecord record : records) {
            if (!record.hasFiniteValue() || Math.abs(record.getValue() - center) / scale <= threshold) {
                out.add(record);
                continue;
            }
            outliers++;
            double original = record.getValue();
            QualityFlags.QualityFlagsBuilder flags = record.getQualityFlags().toBuilder()
                    .outlier(true)
                    .outlierMethod(config.getMethod().key())
                    .threshold(threshold)
                    .originalValue(original);

            switch (config.getAction()) {
                case SET_NAN -> out.add(record.withValue(Double.NaN, flags
                        .missing(true)
                        .missingReason(MissingReason.UNKNOWN)
                        .build()));
                case CLIP -> out.add(record.withValue(Math.max(lower, Math.min(upper, original)), flags.build()));
                case KEEP -> out.add(record.withValue(original, flags.build()));
            }
        }
        return new Result(out, outliers);
    }

    public record Result(List<CanonicalRecord> records, int outlierCount) {
    }
}
