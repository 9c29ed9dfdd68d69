package com.location.resolution.core.model;

import java.util.List;

/**
 * A city with every postal code the index lists for it.
 *
 * @param postalCodes distinct postal codes, sorted
 */
public record CityLookupResult(
        String city,
        List<String> postalCodes,
        String region,
        String district,
        String country,
        String countryCode,
        GeographicCoordinates coordinates,
        double confidence,
        String displayName
) {
    public CityLookupResult {
        postalCodes = postalCodes != null ? List.copyOf(postalCodes) : List.of();
    }
}
