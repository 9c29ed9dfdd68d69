package com.location.resolution.upstream;

import com.location.resolution.core.model.GeographicCoordinates;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Client of the externally hosted postal/city/region location index.
 * Implementations never complete a future exceptionally: every failure is
 * reported as a non-OK {@link LookupOutcome}.
 */
public interface LocationIndexClient {

    /**
     * {@code GET /locations/nearby?lat&lng&radius&country&limit}
     */
    CompletableFuture<LookupOutcome<List<IndexRow>>> nearby(GeographicCoordinates center, double radiusKm,
                                                            String countryCode, int limit);

    /**
     * {@code GET /locations/postal-lookup?postal_code&country&limit}
     */
    CompletableFuture<LookupOutcome<List<IndexRow>>> postalLookup(String postalCode, String countryCode, int limit);

    /**
     * {@code GET /locations/city-lookup?city&country&limit}
     */
    CompletableFuture<LookupOutcome<List<IndexRow>>> cityLookup(String city, String countryCode, int limit);

    /**
     * {@code GET /locations/region-lookup?region&country&limit}
     */
    CompletableFuture<LookupOutcome<List<IndexRow>>> regionLookup(String region, String countryCode, int limit);
}
