package com.quakesignal.engine.domain.service.spatial;

public final class GeoDistance {

    public static final double EARTH_RADIUS_KM = 6371.0;

    private GeoDistance() {
    }

    public static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dPhi = phi2 - phi1;
        double dLambda = Math.toRadians(lon2 - lon1);
        double sinPhi = Math.sin(dPhi / 2.0);
        double sinLambda = Math.sin(dLambda / 2.0);
        double a = sinPhi * sinPhi + Math.cos(phi1) * Math.cos(phi2) * sinLambda * sinLambda;
        return 2.0 * EARTH_RADIUS_KM * Math.asin(Math.min(1.0, Math.sqrt(a)));
    }

    public static double normalizeLongitude(double lon) {
        double normalized = ((lon + 180.0) % 360.0 + 360.0) % 360.0 - 180.0;
        return normalized == -180.0 && lon > 0 ? 180.0 : normalized;
    }

    public static boolean isValidLatitude(double lat) {
        return Double.isFinite(lat) && lat >= -90.0 && lat <= 90.0;
    }
}
