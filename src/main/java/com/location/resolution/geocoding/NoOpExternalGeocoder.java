package com.location.resolution.geocoding;

import com.location.resolution.core.model.GeocodingResult;
import com.location.resolution.upstream.LookupOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Geocoder used when no external service is configured. Resolves nothing, so
 * only the in-memory store answers.
 */
public class NoOpExternalGeocoder implements ExternalGeocoder {
    private static final Logger log = LoggerFactory.getLogger(NoOpExternalGeocoder.class);

    @Override
    public CompletableFuture<LookupOutcome<GeocodingResult>> resolve(String freeText, String preferredCountry) {
        log.debug("NoOp geocoder called for '{}'", freeText);
        return CompletableFuture.completedFuture(LookupOutcome.notFound("No external geocoder configured"));
    }

    @Override
    public String getProviderName() {
        return "NoOp";
    }
}
