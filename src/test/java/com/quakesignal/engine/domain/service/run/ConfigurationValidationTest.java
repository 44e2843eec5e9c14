package com.quakesignal.engine.domain.service.run;

import com.quakesignal.engine.domain.exception.InvalidConfigurationException;
import com.quakesignal.engine.domain.service.align.AlignProperties;
import com.quakesignal.engine.domain.service.baseline.BaselineProperties;
import com.quakesignal.engine.domain.service.feature.FeatureProperties;
import com.quakesignal.engine.domain.service.link.LinkProperties;
import com.quakesignal.engine.domain.service.quality.QualityProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigurationValidationTest {

    @Test
    void defaultsAreValid() {
        assertThatCode(() -> {
            new QualityProperties().validate();
            new AlignProperties().validate();
            new LinkProperties().validate();
            new FeatureProperties().validate();
            new BaselineProperties().validate();
            new RunProperties().validate();
        }).doesNotThrowAnyException();
    }

    @Test
    void nonPositiveRadiusIsRejected() {
        LinkProperties link = new LinkProperties();
        link.setRadiusKm(0.0);

        assertThatThrownBy(link::validate)
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("radius-km");
    }

    @Test
    void invertedOrEmptyLinkWindowIsRejected() {
        LinkProperties inverted = new LinkProperties();
        inverted.setWindowBeforeHours(-1);
        LinkProperties empty = new LinkProperties();
        empty.setWindowBeforeHours(0);
        empty.setWindowAfterHours(0);

        assertThatThrownBy(inverted::validate).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(empty::validate).hasMessageContaining("empty");
    }

    @Test
    void forwardFillOnSpectralSourceIsRejected() {
        AlignProperties align = new AlignProperties();
        AlignProperties.Policy policy = new AlignProperties.Policy();
        policy.setForwardFill(true);
        policy.setForwardFillLimit(3);
        align.setPolicies(Map.of("vlf", policy));

        assertThatThrownBy(align::validate)
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("vlf");
    }

    @Test
    void reindexToleranceMustStayBelowHalfAStep() {
        AlignProperties align = new AlignProperties();
        align.setGridStep(Duration.ofMinutes(1));
        align.setReindexToleranceMs(30_000);

        assertThatThrownBy(align::validate).isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void qualityRejectsUnknownDenoiseSourceAndNonPositiveThreshold() {
        QualityProperties unknown = new QualityProperties();
        unknown.setDenoise(Map.of("radio", new QualityProperties.Denoise()));
        QualityProperties threshold = new QualityProperties();
        threshold.getOutlier().setThreshold(0.0);

        assertThatThrownBy(unknown::validate).hasMessageContaining("radio");
        assertThatThrownBy(threshold::validate).hasMessageContaining("threshold");
    }

    @Test
    void baselineThresholdMustLieAboveOneHalf() {
        BaselineProperties baseline = new BaselineProperties();
        baseline.setAnomalyThreshold(0.5);

        assertThatThrownBy(baseline::validate).isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void staLtaWindowsMustBeOrdered() {
        FeatureProperties feature = new FeatureProperties();
        feature.getStaLta().setStaPoints(30);
        feature.getStaLta().setLtaPoints(3);

        assertThatThrownBy(feature::validate).hasMessageContaining("sta-lta");
    }

    @Test
    void partitionQueueCapacityMustBeAPowerOfTwo() {
        RunProperties run = new RunProperties();
        run.setPartitionQueueCapacity(1000);

        assertThatThrownBy(run::validate).hasMessageContaining("power of two");
    }

    @Test
    void configuredEventWithoutTimeIsRejected() {
        RunProperties run = new RunProperties();
        RunProperties.EventSpec event = new RunProperties.EventSpec();
        event.setEventId("E1");
        run.setEvents(List.of(event));

        assertThatThrownBy(run::validate).hasMessageContaining("time is required");
    }
}
