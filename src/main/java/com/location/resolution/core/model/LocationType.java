package com.location.resolution.core.model;

import java.util.Locale;

/**
 * Granularity of a named place.
 */
public enum LocationType {
    CITY,
    TOWN,
    VILLAGE,
    REGION,
    SUBURB,
    DISTRICT,
    COUNTRY;

    /**
     * Lowercase name as used on the wire ("city", "town", ...).
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire name, falling back to {@link #CITY} for unknown or missing values.
     */
    public static LocationType fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return CITY;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return CITY;
        }
    }
}
