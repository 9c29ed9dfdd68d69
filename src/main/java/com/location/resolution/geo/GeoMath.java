package com.location.resolution.geo;

import com.location.resolution.core.model.GeographicCoordinates;
import com.location.resolution.core.model.MapBounds;

import java.util.List;
import java.util.Locale;

/**
 * Great-circle distance and viewport math. Pure functions.
 */
public final class GeoMath {

    /** Mean earth radius in kilometers. */
    public static final double EARTH_RADIUS_KM = 6371.0;

    /** Fraction of the coordinate spread added on each side of a bounding box. */
    public static final double BOUNDS_PADDING = 0.1;

    private GeoMath() {
    }

    /**
     * Haversine distance in kilometers.
     */
    public static double distance(GeographicCoordinates a, GeographicCoordinates b) {
        double dLat = Math.toRadians(b.lat() - a.lat());
        double dLng = Math.toRadians(b.lng() - a.lng());

        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(a.lat())) * Math.cos(Math.toRadians(b.lat()))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        // rounding can push h past 1 for antipodal points
        h = Math.min(1.0, h);

        double c = 2 * Math.asin(Math.sqrt(h));
        return EARTH_RADIUS_KM * c;
    }

    /**
     * Bounding box of the points, padded by 10% of the latitude and longitude
     * spread. A single point yields a degenerate box; no points yield
     * {@link MapBounds#EMPTY}.
     */
    public static MapBounds bounds(List<GeographicCoordinates> points) {
        if (points == null || points.isEmpty()) {
            return MapBounds.EMPTY;
        }

        double north = points.get(0).lat();
        double south = north;
        double east = points.get(0).lng();
        double west = east;

        for (GeographicCoordinates point : points) {
            north = Math.max(north, point.lat());
            south = Math.min(south, point.lat());
            east = Math.max(east, point.lng());
            west = Math.min(west, point.lng());
        }

        double latPadding = (north - south) * BOUNDS_PADDING;
        double lngPadding = (east - west) * BOUNDS_PADDING;

        return new MapBounds(north + latPadding, south - latPadding, east + lngPadding, west - lngPadding);
    }

    /**
     * Map zoom level that frames a search radius. Presentation hint only.
     */
    public static int optimalZoom(double radiusKm) {
        if (radiusKm <= 1) return 15;
        if (radiusKm <= 5) return 13;
        if (radiusKm <= 10) return 12;
        if (radiusKm <= 25) return 11;
        if (radiusKm <= 50) return 10;
        if (radiusKm <= 100) return 9;
        return 8;
    }

    /**
     * Formats a distance as whole meters below one kilometer ("350m"), otherwise
     * as kilometers with one decimal ("12.3km").
     */
    public static String formatDistance(double distanceKm) {
        if (distanceKm < 1) {
            return Math.round(distanceKm * 1000) + "m";
        }
        return String.format(Locale.ROOT, "%.1fkm", distanceKm);
    }
}
