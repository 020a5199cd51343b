package com.deliverzler.triptracking.util;

/**
 * Utility class for great-circle calculations on latitude/longitude pairs.
 *
 * All distances are in meters on a spherical Earth (Haversine). Bearing-based
 * cross-track distance is used by the track optimizer for path simplification.
 */
public final class GeoUtil {

    // Earth's radius in meters
    public static final double EARTH_RADIUS_METERS = 6371000;

    private GeoUtil() {
    }

    /**
     * Calculate distance between two GPS coordinates using Haversine formula
     *
     * @param lat1 Latitude of first point
     * @param lon1 Longitude of first point
     * @param lat2 Latitude of second point
     * @param lon2 Longitude of second point
     * @return Distance in meters
     */
    public static double haversineMeters(double lat1, double lon1, double lat2, double lon2) {
        return EARTH_RADIUS_METERS * centralAngle(
                Math.toRadians(lat1), Math.toRadians(lon1),
                Math.toRadians(lat2), Math.toRadians(lon2));
    }

    /**
     * Check if a point is within a radius of a target
     *
     * @param lat1 Latitude of point to check
     * @param lon1 Longitude of point to check
     * @param lat2 Latitude of target center
     * @param lon2 Longitude of target center
     * @param radiusMeters Radius in meters
     * @return true if point is within radius, false otherwise
     */
    public static boolean isWithinRadius(double lat1, double lon1, double lat2, double lon2, double radiusMeters) {
        return haversineMeters(lat1, lon1, lat2, lon2) <= radiusMeters;
    }

    /**
     * Perpendicular (cross-track) distance from a point to the great circle through
     * {@code start} and {@code end}, approximated as {@code d13 * |sin(θ13 - θ12)|}.
     * Falls back to point-to-point distance when start and end coincide.
     *
     * @return distance in meters
     */
    public static double crossTrackMeters(double lat, double lon,
                                          double startLat, double startLon,
                                          double endLat, double endLon) {
        double latRad1 = Math.toRadians(startLat);
        double lonRad1 = Math.toRadians(startLon);
        double latRad2 = Math.toRadians(endLat);
        double lonRad2 = Math.toRadians(endLon);
        double latRadP = Math.toRadians(lat);
        double lonRadP = Math.toRadians(lon);

        if (latRad1 == latRad2 && lonRad1 == lonRad2) {
            return EARTH_RADIUS_METERS * centralAngle(latRadP, lonRadP, latRad1, lonRad1);
        }

        double bearingToEnd = bearing(latRad1, lonRad1, latRad2, lonRad2);
        double bearingToPoint = bearing(latRad1, lonRad1, latRadP, lonRadP);
        double distToPoint = EARTH_RADIUS_METERS * centralAngle(latRad1, lonRad1, latRadP, lonRadP);

        return distToPoint * Math.abs(Math.sin(bearingToPoint - bearingToEnd));
    }

    // Initial bearing in radians, inputs in radians
    private static double bearing(double lat1, double lon1, double lat2, double lon2) {
        double dLon = lon2 - lon1;
        double y = Math.sin(dLon) * Math.cos(lat2);
        double x = Math.cos(lat1) * Math.sin(lat2) - Math.sin(lat1) * Math.cos(lat2) * Math.cos(dLon);
        return Math.atan2(y, x);
    }

    private static double centralAngle(double lat1, double lon1, double lat2, double lon2) {
        double deltaLat = lat2 - lat1;
        double deltaLon = lon2 - lon1;

        // Haversine formula
        double a = Math.sin(deltaLat / 2) * Math.sin(deltaLat / 2) +
                   Math.cos(lat1) * Math.cos(lat2) *
                   Math.sin(deltaLon / 2) * Math.sin(deltaLon / 2);

        return 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    }
}
