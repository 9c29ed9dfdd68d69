package com.location.resolution.core.model;

/**
 * Viewport box in degrees.
 */
public record MapBounds(double north, double south, double east, double west) {

    /** All-zero box, returned when there is nothing to frame. */
    public static final MapBounds EMPTY = new MapBounds(0, 0, 0, 0);

    public boolean contains(GeographicCoordinates point) {
        return point.lat() <= north && point.lat() >= south
                && point.lng() <= east && point.lng() >= west;
    }
}
