package com.location.resolution.matching;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Ordered list of {@link ScoringRule}s. Evaluation stops at the first rule that
 * matches.
 *
 * @param <T> the candidate type
 */
public class ScoringRuleSet<T> {

    private final List<ScoringRule<T>> rules;

    public ScoringRuleSet(List<ScoringRule<T>> rules) {
        List<ScoringRule<T>> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(ScoringRule::getPriority));
        this.rules = List.copyOf(sorted);
    }

    public List<ScoringRule<T>> getRules() {
        return rules;
    }

    /**
     * Returns the first matching rule.
     */
    public Optional<ScoringRule<T>> firstMatch(T candidate, String query) {
        for (ScoringRule<T> rule : rules) {
            if (rule.matches(candidate, query)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the score of the first matching rule, or empty when no rule matches.
     */
    public OptionalDouble score(T candidate, String query) {
        return firstMatch(candidate, query)
                .map(rule -> OptionalDouble.of(rule.getScore()))
                .orElse(OptionalDouble.empty());
    }

    /**
     * Returns the score of the first matching rule, or {@code floor}.
     */
    public double scoreOrDefault(T candidate, String query, double floor) {
        return score(candidate, query).orElse(floor);
    }
}
