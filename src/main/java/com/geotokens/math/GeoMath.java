package com.geotokens.math;

/** Great-circle distance on a spherical earth. Positions are (lat, lng) in degrees. */
public final class GeoMath {

    /** Mean earth radius in metres (same sphere web maps use). */
    public static final double EARTH_RADIUS_METERS = 6_371_000.0;

    private GeoMath() {}

    /** Finite, with latitude in [-90, 90] and longitude in [-180, 180]. */
    public static boolean isValidPosition(double lat, double lng) {
        return Double.isFinite(lat) && Double.isFinite(lng)
            && lat >= -90 && lat <= 90 && lng >= -180 && lng <= 180;
    }

    /** Haversine distance between two lat/lng points. */
    public static double distanceMeters(double lat1, double lng1, double lat2, double lng2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dPhi = Math.toRadians(lat2 - lat1);
        double dLambda = Math.toRadians(lng2 - lng1);
        double sinPhi = Math.sin(dPhi / 2);
        double sinLambda = Math.sin(dLambda / 2);
        double a = sinPhi * sinPhi + Math.cos(phi1) * Math.cos(phi2) * sinLambda * sinLambda;
        return 2 * EARTH_RADIUS_METERS * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    }
}
