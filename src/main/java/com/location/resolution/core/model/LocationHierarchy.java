package com.location.resolution.core.model;

import java.util.Objects;

/**
 * Denormalized administrative view of a resolved place, returned with every
 * resolution so callers need no secondary lookup.
 */
public record LocationHierarchy(
        String country,
        String countryCode,
        String region,
        String district,
        String city,
        String suburb,
        String village,
        String postalCode,
        GeographicCoordinates coordinates,
        Long population,
        LocationType locationType
) {
    public LocationHierarchy {
        Objects.requireNonNull(coordinates, "coordinates is required");
        Objects.requireNonNull(locationType, "locationType is required");
    }

    /**
     * Derives the hierarchy of a store record.
     */
    public static LocationHierarchy of(LocationRecord record) {
        return new LocationHierarchy(
                record.country(),
                record.countryCode(),
                record.region(),
                record.district(),
                record.name(),
                null,
                null,
                null,
                record.coordinates(),
                record.population(),
                record.locationType()
        );
    }

    /**
     * Formats {@code city[, district][, region]}; the district is omitted when it
     * repeats the city name.
     */
    public String displayName() {
        StringBuilder sb = new StringBuilder(city);
        if (district != null && !district.isEmpty() && !district.equals(city)) {
            sb.append(", ").append(district);
        }
        if (region != null && !region.isEmpty()) {
            sb.append(", ").append(region);
        }
        return sb.toString();
    }
}
