package com.quakesignal.engine.domain.model;

public record Station(String stationId, double lat, double lon, Double elevM) {

    public Station {
        if (stationId == null || stationId.isBlank()) {
            throw new IllegalArgumentException("stationId must not be blank");
        }
        if (!Double.isFinite(lat) || lat < -90.0 || lat > 90.0) {
            throw new IllegalArgumentException("latitude out of range: " + lat);
        }
        if (!Double.isFinite(lon)) {
            throw new IllegalArgumentException("longitude must be finite");
        }
    }
}
