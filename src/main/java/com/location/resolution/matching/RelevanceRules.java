package com.location.resolution.matching;

import java.util.List;

/**
 * Name relevance policy for autocomplete. Candidates and queries are expected
 * to be lowercased already.
 */
public final class RelevanceRules {

    public static final double EXACT = 1.0;
    public static final double PREFIX = 0.9;
    public static final double SUBSTRING = 0.7;

    private RelevanceRules() {
    }

    public static ScoringRuleSet<String> defaults() {
        return new ScoringRuleSet<>(List.of(
                ScoringRule.<String>builder()
                        .name("exact")
                        .when(String::equals)
                        .score(EXACT)
                        .priority(10)
                        .build(),
                ScoringRule.<String>builder()
                        .name("prefix")
                        .when(String::startsWith)
                        .score(PREFIX)
                        .priority(20)
                        .build(),
                ScoringRule.<String>builder()
                        .name("substring")
                        .when(String::contains)
                        .score(SUBSTRING)
                        .priority(30)
                        .build()
        ));
    }
}
