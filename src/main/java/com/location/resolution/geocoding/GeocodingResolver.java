package com.location.resolution.geocoding;

import com.location.resolution.cache.CacheStats;
import com.location.resolution.cache.LookupCache;
import com.location.resolution.core.model.GeocodingResult;
import com.location.resolution.core.model.GeocodingSource;
import com.location.resolution.core.model.LocationSearchResult;
import com.location.resolution.logging.LogContext;
import com.location.resolution.matching.RelevanceRules;
import com.location.resolution.matching.StaticMatcher;
import com.location.resolution.metrics.MetricsService;
import com.location.resolution.upstream.LookupOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Two-tier geocoding: the in-memory store first, the external geocoder on a miss.
 * Successful resolutions are cached under the normalized (trimmed, lowercased) query.
 */
public class GeocodingResolver {
    private static final Logger log = LoggerFactory.getLogger(GeocodingResolver.class);

    static final double STATIC_EXACT_CONFIDENCE = 1.0;
    static final double STATIC_PARTIAL_CONFIDENCE = 0.8;

    private final StaticMatcher matcher;
    private final ExternalGeocoder externalGeocoder;
    private final LookupCache<String, GeocodingResult> cache;
    private final MetricsService metrics;

    public GeocodingResolver(StaticMatcher matcher, ExternalGeocoder externalGeocoder,
                             LookupCache<String, GeocodingResult> cache, MetricsService metrics) {
        this.matcher = matcher;
        this.externalGeocoder = externalGeocoder;
        this.cache = cache;
        this.metrics = metrics;
    }

    /**
     * Resolves a place name. Completes with empty when neither tier knows the
     * place or the external geocoder is unreachable; never completes exceptionally.
     */
    public CompletableFuture<Optional<GeocodingResult>> geocode(String name, GeocodingOptions options) {
        String normalized = normalize(name);
        if (normalized.isEmpty()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        long start = System.nanoTime();

        try (LogContext ctx = LogContext.forGeocode(LogContext.generateCorrelationId(), normalized)) {
            if (options.isUseCache()) {
                Optional<GeocodingResult> cached = cache.get(normalized);
                if (cached.isPresent()) {
                    log.debug("Geocode cache hit for '{}'", normalized);
                    return CompletableFuture.completedFuture(cached);
                }
            }

            Optional<GeocodingResult> staticResult = staticGeocode(normalized);
            if (staticResult.isPresent()) {
                log.debug("Geocoded '{}' from store: {}", normalized, staticResult.get().hierarchy().city());
                complete(normalized, staticResult.get(), options, LookupOutcome.Status.OK, start);
                return CompletableFuture.completedFuture(staticResult);
            }
        }

        CompletableFuture<LookupOutcome<GeocodingResult>> external;
        try {
            external = externalGeocoder.resolve(name.trim(), options.getPreferredCountry());
        } catch (RuntimeException e) {
            external = CompletableFuture.failedFuture(e);
        }

        return external
                .handle((outcome, error) -> {
                    if (error != null) {
                        log.warn("External geocoder {} failed for '{}': {}",
                                externalGeocoder.getProviderName(), normalized, error.toString());
                        outcome = LookupOutcome.unavailable(error.toString());
                    }
                    if (outcome.isOk()) {
                        complete(normalized, outcome.value(), options, LookupOutcome.Status.OK, start);
                        return Optional.of(outcome.value());
                    }
                    if (outcome.isFailure()) {
                        metrics.recordUpstreamFailure("geocoder", outcome.status());
                        log.warn("Geocoding '{}' degraded to unknown: {} ({})",
                                normalized, outcome.status(), outcome.reason());
                    } else {
                        log.debug("Location '{}' unknown: {}", normalized, outcome.reason());
                    }
                    metrics.recordLookupDuration("geocode", outcome.status(), elapsed(start));
                    return Optional.<GeocodingResult>empty();
                });
    }

    public CompletableFuture<Optional<GeocodingResult>> geocode(String name) {
        return geocode(name, GeocodingOptions.defaults());
    }

    /**
     * Autocomplete over the in-memory store. No network call is made.
     */
    public List<LocationSearchResult> search(String query, int limit) {
        return matcher.match(query, limit);
    }

    public void clearCache() {
        cache.invalidateAll();
    }

    public CacheStats cacheStats() {
        return cache.getStats();
    }

    private Optional<GeocodingResult> staticGeocode(String normalized) {
        return matcher.bestMatch(normalized).map(GeocodingResolver::toGeocodingResult);
    }

    static GeocodingResult toGeocodingResult(LocationSearchResult match) {
        double confidence = match.relevanceScore() >= RelevanceRules.EXACT
                ? STATIC_EXACT_CONFIDENCE
                : STATIC_PARTIAL_CONFIDENCE;
        return new GeocodingResult(match.coordinates(), match.hierarchy(), GeocodingSource.STATIC, confidence);
    }

    private void complete(String key, GeocodingResult result, GeocodingOptions options,
                          LookupOutcome.Status status, long start) {
        if (options.isUseCache()) {
            cache.put(key, result);
        }
        metrics.recordConfidence(result.confidence());
        metrics.recordLookupDuration("geocode", status, elapsed(start));
    }

    private static Duration elapsed(long start) {
        return Duration.ofNanos(System.nanoTime() - start);
    }

    static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
