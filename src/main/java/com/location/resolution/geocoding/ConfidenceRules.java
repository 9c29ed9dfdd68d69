package com.location.resolution.geocoding;

import com.location.resolution.matching.ScoringRule;
import com.location.resolution.matching.ScoringRuleSet;

import java.util.List;
import java.util.Locale;

/**
 * Confidence policy for external geocoder hits. The query passed to the rules
 * is lowercased.
 */
public final class ConfidenceRules {

    /** Confidence when no rule matches. */
    public static final double FLOOR = 0.6;

    private ConfidenceRules() {
    }

    public static ScoringRuleSet<NominatimPlace> defaults() {
        return new ScoringRuleSet<>(List.of(
                ScoringRule.<NominatimPlace>builder()
                        .name("display-name-contains")
                        .when((place, query) -> lower(place.displayName()).contains(query))
                        .score(0.9)
                        .priority(10)
                        .build(),
                ScoringRule.<NominatimPlace>builder()
                        .name("component-equals")
                        .when((place, query) -> place.address().values().stream()
                                .anyMatch(v -> lower(v).equals(query)))
                        .score(0.8)
                        .priority(20)
                        .build(),
                ScoringRule.<NominatimPlace>builder()
                        .name("component-contains")
                        .when((place, query) -> place.address().values().stream()
                                .anyMatch(v -> lower(v).contains(query)))
                        .score(0.7)
                        .priority(30)
                        .build()
        ));
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
