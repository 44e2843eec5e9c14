package com.quakesignal.engine.domain.service.spatial;

import com.quakesignal.engine.domain.model.Station;

import java.util.Comparator;

public record StationHit(int index, Station station, double distanceKm) {

    public static final Comparator<StationHit> BY_DISTANCE = Comparator
            .comparingDouble(StationHit::distanceKm)
            .thenComparing(hit -> hit.station().stationId());

    public String stationId() {
        return station.stationId();
    }
}
