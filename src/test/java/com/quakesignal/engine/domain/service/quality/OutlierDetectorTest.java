package com.quakesignal.engine.domain.service.quality;

import com.quakesignal.engine.domain.model.CanonicalRecord;
import com.quakesignal.engine.domain.model.SourceType;
import com.quakesignal.engine.domain.service.signal.RobustStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.quakesignal.engine.support.Records.MINUTE_MS;
import static com.quakesignal.engine.support.Records.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

class OutlierDetectorTest {

    private static final long T0 = 1_672_531_200_000L;
    private static final int SPIKE = 10;

    private QualityProperties properties;
    private List<CanonicalRecord> input;

    @BeforeEach
    void setUp() {
        properties = new QualityProperties();
        input = series(SourceType.GEOMAG, "KAK", "X", T0, MINUTE_MS, 20, i -> i == SPIKE ? 1_000.0 : i % 5);
    }

    @Test
    void clipPinsSpikeToUpperBoundAndKeepsOriginal() {
        properties.getOutlier().setAction(OutlierAction.CLIP);

        OutlierDetector.Result result = new OutlierDetector(properties).apply(input);

        double[] values = input.stream().mapToDouble(CanonicalRecord::getValue).toArray();
        double center = RobustStats.median(values);
        double upper = center + properties.getOutlier().getThreshold() * RobustStats.robustScale(values, center);
        CanonicalRecord clipped = result.records().get(SPIKE);
        assertThat(result.outlierCount()).isEqualTo(1);
        assertThat(clipped.getValue()).isCloseTo(upper, offset(1e-9));
        assertThat(clipped.getValue()).isLessThan(1_000.0);
        assertThat(clipped.getQualityFlags().isOutlier()).isTrue();
        assertThat(clipped.getQualityFlags().isMissing()).isFalse();
        assertThat(clipped.getQualityFlags().getOriginalValue()).isEqualTo(1_000.0);
        assertThat(clipped.getQualityFlags().getOutlierMethod()).isEqualTo("mad");
    }

    @Test
    void keepFlagsSpikeWithoutChangingIt() {
        properties.getOutlier().setAction(OutlierAction.KEEP);

        OutlierDetector.Result result = new OutlierDetector(properties).apply(input);

        CanonicalRecord kept = result.records().get(SPIKE);
        assertThat(result.outlierCount()).isEqualTo(1);
        assertThat(kept.getValue()).isEqualTo(1_000.0);
        assertThat(kept.getQualityFlags().isOutlier()).isTrue();
        assertThat(kept.getQualityFlags().isMissing()).isFalse();
        assertThat(kept.getQualityFlags().getOriginalValue()).isEqualTo(1_000.0);
        assertThat(result.records().get(SPIKE - 1).getQualityFlags().isOutlier()).isFalse();
    }

    @Test
    void setNanBlanksSpikeAndMarksItMissing() {
        OutlierDetector.Result result = new OutlierDetector(properties).apply(input);

        CanonicalRecord blanked = result.records().get(SPIKE);
        assertThat(blanked.getValue()).isNaN();
        assertThat(blanked.getQualityFlags().isMissing()).isTrue();
        assertThat(blanked.getQualityFlags().getOriginalValue()).isEqualTo(1_000.0);
    }

    @Test
    void tooFewFinitePointsLeaveInputUntouched() {
        List<CanonicalRecord> two = input.subList(SPIKE - 1, SPIKE + 1);

        OutlierDetector.Result result = new OutlierDetector(properties).apply(two);

        assertThat(result.outlierCount()).isZero();
        assertThat(result.records()).isSameAs(two);
    }
}
