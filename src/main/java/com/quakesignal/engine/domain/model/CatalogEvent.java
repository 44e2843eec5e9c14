package com.quakesignal.engine.domain.model;

import java.time.Instant;

public record CatalogEvent(String eventId, Instant originTime, double lat, double lon, Double depthKm, Double mag) {

    public CatalogEvent {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("eventId must not be blank");
        }
        if (originTime == null) {
            throw new IllegalArgumentException("originTime must not be null");
        }
        if (!Double.isFinite(lat) || lat < -90.0 || lat > 90.0 || !Double.isFinite(lon)) {
            throw new IllegalArgumentException("invalid epicenter for event " + eventId);
        }
    }

    public long originTimeMs() {
        return originTime.toEpochMilli();
    }
}
