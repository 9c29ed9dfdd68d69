package com.location.resolution.core.model;

/**
 * A point on the earth's surface in decimal degrees.
 *
 * @param lat latitude, -90 to 90
 * @param lng longitude, -180 to 180
 */
public record GeographicCoordinates(double lat, double lng) {

    public GeographicCoordinates {
        if (!isValid(lat, lng)) {
            throw new IllegalArgumentException(
                    "Coordinates out of range: lat=" + lat + ", lng=" + lng);
        }
    }

    public static GeographicCoordinates of(double lat, double lng) {
        return new GeographicCoordinates(lat, lng);
    }

    /**
     * Returns true if the pair is finite and inside the latitude/longitude ranges.
     */
    public static boolean isValid(double lat, double lng) {
        return Double.isFinite(lat) && Double.isFinite(lng)
                && lat >= -90.0 && lat <= 90.0
                && lng >= -180.0 && lng <= 180.0;
    }
}
