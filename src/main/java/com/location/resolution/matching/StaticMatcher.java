package com.location.resolution.matching;

import com.location.resolution.core.model.LocationHierarchy;
import com.location.resolution.core.model.LocationRecord;
import com.location.resolution.core.model.LocationSearchResult;
import com.location.resolution.store.LocationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Exact/prefix/substring name matching against the {@link LocationStore}.
 * Pure computation; never performs I/O.
 */
public class StaticMatcher {
    private static final Logger log = LoggerFactory.getLogger(StaticMatcher.class);

    /** Queries shorter than this return nothing. */
    public static final int MIN_QUERY_LENGTH = 2;
    public static final int DEFAULT_LIMIT = 10;

    private static final Comparator<LocationSearchResult> ORDERING =
            Comparator.comparingDouble(LocationSearchResult::relevanceScore).reversed()
                    .thenComparing(Comparator.comparingLong(LocationSearchResult::populationOrZero).reversed());

    private final LocationStore store;
    private final ScoringRuleSet<String> rules;

    public StaticMatcher(LocationStore store) {
        this(store, RelevanceRules.defaults());
    }

    public StaticMatcher(LocationStore store, ScoringRuleSet<String> rules) {
        this.store = store;
        this.rules = rules;
    }

    public List<LocationSearchResult> match(String query) {
        return match(query, DEFAULT_LIMIT);
    }

    /**
     * Scores every store record against the query and returns the best
     * {@code limit} matches ordered by relevance, then population.
     */
    public List<LocationSearchResult> match(String query, int limit) {
        String normalized = normalize(query);
        if (normalized.length() < MIN_QUERY_LENGTH || limit <= 0) {
            return List.of();
        }

        List<LocationSearchResult> results = new ArrayList<>();
        for (LocationRecord record : store.all()) {
            scoreRecord(record, normalized).ifPresent(results::add);
        }
        results.sort(ORDERING);

        log.debug("Static match for '{}': {} candidates", normalized, results.size());
        return results.size() > limit ? List.copyOf(results.subList(0, limit)) : List.copyOf(results);
    }

    /**
     * Returns the single best match.
     */
    public Optional<LocationSearchResult> bestMatch(String query) {
        List<LocationSearchResult> results = match(query, 1);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public LocationStore getStore() {
        return store;
    }

    private Optional<LocationSearchResult> scoreRecord(LocationRecord record, String query) {
        double bestScore = score(record.name(), query);
        String matchedName = record.name();

        for (String variant : record.nameVariants()) {
            double variantScore = score(variant, query);
            if (variantScore > bestScore) {
                bestScore = variantScore;
                matchedName = variant;
            }
        }

        if (bestScore <= 0.0) {
            return Optional.empty();
        }

        LocationHierarchy hierarchy = LocationHierarchy.of(record);
        return Optional.of(new LocationSearchResult(
                matchedName,
                hierarchy.displayName(),
                record.coordinates(),
                hierarchy,
                bestScore
        ));
    }

    private double score(String candidate, String query) {
        if (candidate == null) {
            return 0.0;
        }
        OptionalDouble score = rules.score(candidate.toLowerCase(Locale.ROOT), query);
        return score.orElse(0.0);
    }

    static String normalize(String query) {
        return query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
    }
}
