package com.quakesignal.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Map;

@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class QualityFlags {

    @JsonProperty("is_missing")
    private boolean missing;
    private MissingReason missingReason;

    @JsonProperty("is_outlier")
    private boolean outlier;
    private String outlierMethod;
    private Double threshold;
    private Double originalValue;

    @JsonProperty("is_interpolated")
    private boolean interpolated;
    private String interpMethod;
    private Long maxGapMs;
    private Long gapMs;

    @JsonProperty("is_filtered")
    private boolean filtered;
    private String filterType;
    private Map<String, Double> filterParams;

    private StationMatch stationMatch;

    public static QualityFlags ok() {
        return new QualityFlags();
    }

    public static QualityFlags missing(MissingReason reason) {
        return QualityFlags.builder()
                .missing(true)
                .missingReason(reason)
                .build();
    }
}
