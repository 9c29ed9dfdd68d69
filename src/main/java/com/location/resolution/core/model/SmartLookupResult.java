package com.location.resolution.core.model;

import java.util.List;

/**
 * Combined postal-code and city lookup for input of unknown kind.
 */
public record SmartLookupResult(List<PostalCodeLookupResult> postalResults, List<CityLookupResult> cityResults) {

    public SmartLookupResult {
        postalResults = postalResults != null ? List.copyOf(postalResults) : List.of();
        cityResults = cityResults != null ? List.copyOf(cityResults) : List.of();
    }

    public boolean isEmpty() {
        return postalResults.isEmpty() && cityResults.isEmpty();
    }
}
