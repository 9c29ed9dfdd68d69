package com.location.resolution.nearby;

import com.location.resolution.cache.CacheStats;
import com.location.resolution.cache.LookupCache;
import com.location.resolution.core.model.GeographicCoordinates;
import com.location.resolution.core.model.MapLocation;
import com.location.resolution.core.model.MapLocationType;
import com.location.resolution.core.model.NearbySearchResult;
import com.location.resolution.geo.GeoMath;
import com.location.resolution.logging.LogContext;
import com.location.resolution.metrics.MetricsService;
import com.location.resolution.upstream.IndexRow;
import com.location.resolution.upstream.LocationIndexClient;
import com.location.resolution.upstream.LookupOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Radius search across one or more country partitions of the location index.
 *
 * <p>Each country is queried concurrently for up to
 * {@code ceil(maxResults / countryCount)} candidates. Candidates are merged,
 * ranked by distance from the center and truncated; {@code totalFound} reports
 * the merged count before truncation. A country whose request fails contributes
 * nothing and does not fail the search.</p>
 */
public class NearbySearchEngine {
    private static final Logger log = LoggerFactory.getLogger(NearbySearchEngine.class);

    static final double REVERSE_GEOCODE_RADIUS_KM = 5.0;

    private final LocationIndexClient indexClient;
    private final LookupCache<NearbyCacheKey, NearbySearchResult> cache;
    private final MetricsService metrics;

    public NearbySearchEngine(LocationIndexClient indexClient,
                              LookupCache<NearbyCacheKey, NearbySearchResult> cache,
                              MetricsService metrics) {
        this.indexClient = indexClient;
        this.cache = cache;
        this.metrics = metrics;
    }

    /**
     * Searches around the options' center. Never completes exceptionally; total
     * upstream failure yields an empty result framed on the center.
     */
    public CompletableFuture<NearbySearchResult> searchNearby(NearbySearchOptions options) {
        NearbyCacheKey key = NearbyCacheKey.of(options);
        Optional<NearbySearchResult> cached = cache.get(key);
        if (cached.isPresent()) {
            return CompletableFuture.completedFuture(cached.get());
        }

        long start = System.nanoTime();
        GeographicCoordinates center = options.getCenter();
        int perCountry = options.perCountryLimit();

        try (LogContext ctx = LogContext.forNearbySearch(LogContext.generateCorrelationId(),
                center.lat(), center.lng(), options.getRadiusKm())) {
            log.debug("Nearby search {} ({} per country)", options, perCountry);
        }

        List<CompletableFuture<CountryBatch>> futures = options.getCountries().stream()
                .map(country -> fetchCountry(country, options, perCountry))
                .toList();

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream()
                        .map(CompletableFuture::join)
                        .toList())
                .thenApply(batches -> {
                    NearbySearchResult result = merge(center, batches, options);
                    boolean degraded = batches.stream().anyMatch(b -> !b.outcomeStatus().equals(LookupOutcome.Status.OK));
                    if (degraded) {
                        log.info("Nearby search returned {} locations with failed countries; result not cached",
                                result.locations().size());
                    } else {
                        cache.put(key, result);
                    }
                    metrics.recordNearbyResults(result.locations().size());
                    metrics.recordLookupDuration("nearby",
                            degraded ? LookupOutcome.Status.UPSTREAM_UNAVAILABLE : LookupOutcome.Status.OK,
                            Duration.ofNanos(System.nanoTime() - start));
                    return result;
                })
                .exceptionally(e -> {
                    log.error("Nearby search failed unexpectedly: {}", e.toString(), e);
                    return new NearbySearchResult(List.of(), center, GeoMath.bounds(List.of(center)), 0);
                });
    }

    /**
     * Finds the closest indexed location within 5 km of the point.
     */
    public CompletableFuture<Optional<MapLocation>> reverseGeocode(GeographicCoordinates coordinates) {
        NearbySearchOptions options = NearbySearchOptions.builder()
                .center(coordinates)
                .radiusKm(REVERSE_GEOCODE_RADIUS_KM)
                .maxResults(1)
                .includeDistance(true)
                .build();
        return searchNearby(options)
                .thenApply(result -> result.locations().stream()
                        .findFirst()
                        .map(location -> location.withType(MapLocationType.SEARCH)));
    }

    public void clearCache() {
        cache.invalidateAll();
    }

    public CacheStats cacheStats() {
        return cache.getStats();
    }

    private CompletableFuture<CountryBatch> fetchCountry(String country, NearbySearchOptions options,
                                                         int perCountry) {
        CompletableFuture<LookupOutcome<List<IndexRow>>> call;
        try {
            call = indexClient.nearby(options.getCenter(), options.getRadiusKm(), country, perCountry);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        return call.handle((outcome, error) -> {
            if (error != null) {
                outcome = LookupOutcome.unavailable(error.toString());
            }
            if (outcome.isFailure()) {
                metrics.recordUpstreamFailure("nearby", outcome.status());
                log.warn("Nearby search for country {} failed: {} ({})", country, outcome.status(), outcome.reason());
                return new CountryBatch(country, outcome.status(), List.of());
            }
            return new CountryBatch(country, LookupOutcome.Status.OK, outcome.orElse(List.of()));
        });
    }

    private NearbySearchResult merge(GeographicCoordinates center, List<CountryBatch> batches,
                                     NearbySearchOptions options) {
        List<Ranked> candidates = new ArrayList<>();
        for (CountryBatch batch : batches) {
            for (IndexRow row : batch.rows()) {
                double distance = GeoMath.distance(center, row.coordinates());
                candidates.add(new Ranked(toMapLocation(row, batch.country(),
                        options.isIncludeDistance() ? distance : null), distance));
            }
        }

        candidates.sort(Comparator.comparingDouble(Ranked::distance));

        List<MapLocation> locations = candidates.stream()
                .limit(options.getMaxResults())
                .map(Ranked::location)
                .toList();

        List<GeographicCoordinates> framed = new ArrayList<>(locations.size() + 1);
        framed.add(center);
        locations.forEach(l -> framed.add(l.coordinates()));

        return new NearbySearchResult(locations, center, GeoMath.bounds(framed), candidates.size());
    }

    static MapLocation toMapLocation(IndexRow row, String requestedCountry, Double distance) {
        String country = row.countryCode() != null ? row.countryCode() : requestedCountry;
        String suffix = row.id() != null ? row.id() : row.cityOrName();
        String id = row.postalCode() != null && !row.postalCode().isBlank()
                ? country + "-" + row.postalCode() + "-" + suffix
                : country + "-" + suffix;
        return new MapLocation(
                id,
                row.cityOrName(),
                row.coordinates(),
                row.postalCode(),
                country,
                row.region(),
                row.district(),
                MapLocationType.NEARBY,
                distance,
                row.confidence()
        );
    }

    record CountryBatch(String country, LookupOutcome.Status outcomeStatus, List<IndexRow> rows) {}

    record Ranked(MapLocation location, double distance) {}

    /**
     * Cache key of a nearby search.
     */
    public record NearbyCacheKey(double lat, double lng, double radiusKm, List<String> countries,
                                 int maxResults, boolean includeDistance) {

        public NearbyCacheKey {
            countries = List.copyOf(countries);
        }

        static NearbyCacheKey of(NearbySearchOptions options) {
            return new NearbyCacheKey(
                    options.getCenter().lat(),
                    options.getCenter().lng(),
                    options.getRadiusKm(),
                    options.getCountries(),
                    options.getMaxResults(),
                    options.isIncludeDistance());
        }
    }
}
