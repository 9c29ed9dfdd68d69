package com.location.resolution.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A curated entry of the in-memory location store.
 * Immutable; list components are defensively copied.
 */
public record LocationRecord(
        String name,
        List<String> nameVariants,
        GeographicCoordinates coordinates,
        String country,
        String countryCode,
        String region,
        String district,
        Long population,
        LocationType locationType,
        List<String> postalCodes
) {
    public LocationRecord {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(coordinates, "coordinates is required");
        Objects.requireNonNull(countryCode, "countryCode is required");
        nameVariants = nameVariants != null ? List.copyOf(nameVariants) : List.of();
        postalCodes = postalCodes != null ? List.copyOf(postalCodes) : List.of();
        locationType = locationType != null ? locationType : LocationType.CITY;
        region = region != null ? region : "";
    }

    /**
     * Population for ordering purposes; absent population sorts as zero.
     */
    public long populationOrZero() {
        return population != null ? population : 0L;
    }
}
