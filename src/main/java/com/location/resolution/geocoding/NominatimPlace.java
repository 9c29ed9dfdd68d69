package com.location.resolution.geocoding;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One element of a Nominatim {@code /search} response.
 * Coordinates arrive as strings and are parsed by the geocoder.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NominatimPlace(
        String lat,
        String lon,
        @JsonProperty("display_name") String displayName,
        Map<String, String> address,
        Map<String, String> extratags
) {
    public NominatimPlace {
        displayName = displayName != null ? displayName : "";
        address = withoutNulls(address);
        extratags = withoutNulls(extratags);
    }

    private static Map<String, String> withoutNulls(Map<String, String> source) {
        if (source == null) {
            return Map.of();
        }
        Map<String, String> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> {
            if (k != null && v != null) {
                copy.put(k, v);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the first non-blank address component among the given keys.
     */
    public String firstAddress(String... keys) {
        for (String key : keys) {
            String value = address.get(key);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    public boolean hasAnyAddress(String... keys) {
        return firstAddress(keys) != null;
    }
}
