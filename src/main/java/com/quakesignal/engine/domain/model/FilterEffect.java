package com.quakesignal.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Getter;

import java.util.SortedMap;

@Getter
@Builder
@JsonPropertyOrder({"method", "params", "raw_std", "filtered_std", "std_ratio"})
public class FilterEffect {

    @JsonIgnore
    private final SeriesKey seriesKey;
    private final String method;
    private final SortedMap<String, Double> params;
    private final double rawStd;
    private final double filteredStd;

    public Double getStdRatio() {
        return rawStd > 0 ? filteredStd / rawStd : null;
    }
}
