package com.location.resolution.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Result of a radius search.
 *
 * @param totalFound number of candidates before truncation to the requested maximum
 */
public record NearbySearchResult(
        List<MapLocation> locations,
        GeographicCoordinates center,
        MapBounds bounds,
        int totalFound
) {
    public NearbySearchResult {
        Objects.requireNonNull(center, "center is required");
        locations = locations != null ? List.copyOf(locations) : List.of();
        bounds = bounds != null ? bounds : MapBounds.EMPTY;
    }

    public boolean hasMore() {
        return totalFound > locations.size();
    }
}
