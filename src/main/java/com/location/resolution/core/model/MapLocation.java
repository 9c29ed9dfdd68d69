package com.location.resolution.core.model;

import java.util.Objects;

/**
 * A nearby-search row.
 *
 * @param distance       distance from the search center in km, or null when not requested
 * @param relevanceScore upstream relevance, or null when the index supplied none
 */
public record MapLocation(
        String id,
        String name,
        GeographicCoordinates coordinates,
        String postalCode,
        String country,
        String region,
        String district,
        MapLocationType type,
        Double distance,
        Double relevanceScore
) {
    public MapLocation {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(coordinates, "coordinates is required");
        Objects.requireNonNull(type, "type is required");
    }

    public MapLocation withType(MapLocationType newType) {
        return new MapLocation(id, name, coordinates, postalCode, country, region, district,
                newType, distance, relevanceScore);
    }

    public MapLocation withDistance(Double newDistance) {
        return new MapLocation(id, name, coordinates, postalCode, country, region, district,
                type, newDistance, relevanceScore);
    }
}
