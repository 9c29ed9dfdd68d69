package com.location.resolution.core.model;

/**
 * Provenance of a geocoding result.
 */
public enum GeocodingSource {
    /** Matched against the in-memory store. */
    STATIC,
    /** Resolved by the third-party geocoder. */
    EXTERNAL
}
