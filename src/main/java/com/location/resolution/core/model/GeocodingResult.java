package com.location.resolution.core.model;

import java.util.Objects;

/**
 * A resolved place.
 *
 * @param coordinates resolved point
 * @param hierarchy   administrative hierarchy of the point
 * @param source      where the result came from
 * @param confidence  monotonic quality signal between 0.0 and 1.0
 */
public record GeocodingResult(
        GeographicCoordinates coordinates,
        LocationHierarchy hierarchy,
        GeocodingSource source,
        double confidence
) {
    public GeocodingResult {
        Objects.requireNonNull(coordinates, "coordinates is required");
        Objects.requireNonNull(hierarchy, "hierarchy is required");
        Objects.requireNonNull(source, "source is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
    }
}
