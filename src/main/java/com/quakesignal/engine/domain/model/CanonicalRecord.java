package com.quakesignal.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CanonicalRecord {

    private long tsMs;
    private SourceType source;
    private String stationId;
    private String channel;
    private double value;
    private String units;
    private Double lat;
    private Double lon;
    private Double elev;
    @Builder.Default
    private QualityFlags qualityFlags = QualityFlags.ok();
    private String procVersion;
    private String paramsHash;

    public SeriesKey seriesKey() {
        return new SeriesKey(source, stationId, channel);
    }

    public boolean hasFiniteValue() {
        return Double.isFinite(value);
    }

    public boolean hasCoordinates() {
        return lat != null && lon != null && Double.isFinite(lat) && Double.isFinite(lon);
    }

    public CanonicalRecord withValue(double newValue, QualityFlags flags) {
        return toBuilder()
                .value(newValue)
                .qualityFlags(flags)
                .build();
    }

    @Override
    public String toString() {
        return "CanonicalRecord{" + source + ":" + stationId + ":" + channel + "@" + tsMs + "=" + value + "}";
    }
}
