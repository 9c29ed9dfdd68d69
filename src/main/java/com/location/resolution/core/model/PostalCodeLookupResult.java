package com.location.resolution.core.model;

/**
 * One postal code of the location index with its place.
 */
public record PostalCodeLookupResult(
        String postalCode,
        String city,
        String region,
        String district,
        String country,
        String countryCode,
        GeographicCoordinates coordinates,
        double confidence,
        String displayName
) {
}
