package com.location.resolution.core.model;

import java.util.Objects;

/**
 * An autocomplete row. {@code relevanceScore} determines ordering only.
 */
public record LocationSearchResult(
        String name,
        String displayName,
        GeographicCoordinates coordinates,
        LocationHierarchy hierarchy,
        double relevanceScore
) {
    public LocationSearchResult {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(hierarchy, "hierarchy is required");
        if (relevanceScore < 0.0 || relevanceScore > 1.0) {
            throw new IllegalArgumentException("Relevance score must be between 0.0 and 1.0");
        }
    }

    public long populationOrZero() {
        return hierarchy.population() != null ? hierarchy.population() : 0L;
    }
}
