package com.location.resolution.geocoding;

import com.location.resolution.core.model.GeocodingResult;
import com.location.resolution.upstream.LookupOutcome;

import java.util.concurrent.CompletableFuture;

/**
 * Fallback resolution of free text through a third-party geocoding service.
 * Implementations never complete the future exceptionally.
 */
public interface ExternalGeocoder {

    /**
     * Resolves free text to a single place.
     *
     * @param freeText         the user's query
     * @param preferredCountry ISO code or English country name used to restrict
     *                         the search, or null for no restriction
     */
    CompletableFuture<LookupOutcome<GeocodingResult>> resolve(String freeText, String preferredCountry);

    /**
     * Returns the name of this geocoder.
     */
    String getProviderName();
}
