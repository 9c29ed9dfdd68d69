package com.location.resolution.core.model;

import java.util.List;

/**
 * A region summary.
 *
 * @param cities           distinct city names, sorted
 * @param postalCodeRanges compressed postal code summary
 * @param coordinates      centroid of all member rows
 */
public record RegionLookupResult(
        String region,
        List<String> cities,
        List<String> postalCodeRanges,
        String country,
        String countryCode,
        GeographicCoordinates coordinates,
        double confidence
) {
    public RegionLookupResult {
        cities = cities != null ? List.copyOf(cities) : List.of();
        postalCodeRanges = postalCodeRanges != null ? List.copyOf(postalCodeRanges) : List.of();
    }
}
