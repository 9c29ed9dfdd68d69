package com.location.resolution.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.location.resolution.core.model.GeographicCoordinates;

import java.util.Objects;
import java.util.Optional;

/**
 * One row of the location index, normalized over the field aliases the index
 * emits (city|name, region|admin_name1, district|admin_name2,
 * countryCode|country, confidence|relevanceScore).
 *
 * @param confidence upstream confidence or relevance, null when the row has neither
 */
public record IndexRow(
        String id,
        String name,
        String city,
        String postalCode,
        String region,
        String district,
        String countryCode,
        GeographicCoordinates coordinates,
        Double confidence
) {
    public IndexRow {
        Objects.requireNonNull(coordinates, "coordinates is required");
    }

    /**
     * City if present, otherwise the place name.
     */
    public String cityOrName() {
        return city != null ? city : name;
    }

    /**
     * Parses a row. Rows without valid coordinates are rejected.
     */
    public static Optional<IndexRow> parse(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        Optional<GeographicCoordinates> coordinates = parseCoordinates(node);
        if (coordinates.isEmpty()) {
            return Optional.empty();
        }
        Double confidence = number(node, "confidence");
        if (confidence == null) {
            confidence = number(node, "relevanceScore");
        }
        if (confidence != null && (confidence < 0.0 || confidence > 1.0)) {
            confidence = Math.max(0.0, Math.min(1.0, confidence));
        }
        return Optional.of(new IndexRow(
                text(node, "id"),
                text(node, "name"),
                text(node, "city"),
                text(node, "postalCode", "postal_code"),
                text(node, "region", "admin_name1"),
                text(node, "district", "admin_name2"),
                text(node, "countryCode", "country", "country_code"),
                coordinates.get(),
                confidence
        ));
    }

    private static Optional<GeographicCoordinates> parseCoordinates(JsonNode node) {
        JsonNode coords = node.get("coordinates");
        Double lat;
        Double lng;
        if (coords != null && coords.isObject()) {
            lat = number(coords, "lat");
            lng = number(coords, "lng");
        } else {
            lat = number(node, "latitude");
            lng = number(node, "longitude");
        }
        if (lat == null || lng == null || !GeographicCoordinates.isValid(lat, lng)) {
            return Optional.empty();
        }
        return Optional.of(new GeographicCoordinates(lat, lng));
    }

    private static String text(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull()) {
                String s = value.asText();
                if (!s.isEmpty()) {
                    return s;
                }
            }
        }
        return null;
    }

    private static Double number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            try {
                double parsed = Double.parseDouble(value.asText().trim());
                return Double.isFinite(parsed) ? parsed : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
