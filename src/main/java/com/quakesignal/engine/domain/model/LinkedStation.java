package com.quakesignal.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
@JsonPropertyOrder({"station_id", "lat", "lon", "elev_m", "distance_km", "station_match", "sources"})
public class LinkedStation {

    private final String stationId;
    private final double lat;
    private final double lon;
    private final Double elevM;
    private final double distanceKm;
    private final StationMatch stationMatch;
    private final List<SourceType> sources;
}
