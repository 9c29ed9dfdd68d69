package com.location.resolution.lookup;

import com.github.benmanes.caffeine.cache.Ticker;
import com.location.resolution.cache.CacheConfig;
import com.location.resolution.cache.CacheStats;
import com.location.resolution.cache.CaffeineLookupCache;
import com.location.resolution.cache.LookupCache;
import com.location.resolution.core.model.CityLookupResult;
import com.location.resolution.core.model.GeographicCoordinates;
import com.location.resolution.core.model.PostalCodeLookupResult;
import com.location.resolution.core.model.RegionLookupResult;
import com.location.resolution.core.model.SmartLookupResult;
import com.location.resolution.country.CountryRegistry;
import com.location.resolution.country.PostalCodes;
import com.location.resolution.logging.LogContext;
import com.location.resolution.metrics.MetricsService;
import com.location.resolution.upstream.IndexRow;
import com.location.resolution.upstream.LocationIndexClient;
import com.location.resolution.upstream.LookupOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Postal code, city and region lookups against the location index.
 *
 * <p>Every operation answers with an empty list when nothing matches or the index
 * is unreachable. Results are cached per operation for successful index
 * responses only.</p>
 */
public class PostalLookupService {
    private static final Logger log = LoggerFactory.getLogger(PostalLookupService.class);

    public static final String DEFAULT_COUNTRY = "DE";
    static final int POSTAL_LIMIT = 8;
    static final int CITY_LIMIT = 8;
    static final int REGION_LIMIT = 50;
    static final double POSTAL_CONFIDENCE = 0.9;
    static final double CITY_CONFIDENCE = 0.8;
    static final double REGION_CONFIDENCE = 0.9;
    static final String UNKNOWN_REGION = "Unknown";

    private static final Pattern POSTAL_LIKE = Pattern.compile("^[0-9A-Z\\- ]{3,10}$", Pattern.CASE_INSENSITIVE);
    private static final Set<String> HOME_MARKETS = Set.of("Germany", "Italy", "Spain", "France");

    private final LocationIndexClient indexClient;
    private final LookupCache<LookupKey, List<PostalCodeLookupResult>> postalCache;
    private final LookupCache<LookupKey, List<CityLookupResult>> cityCache;
    private final LookupCache<LookupKey, List<RegionLookupResult>> regionCache;
    private final MetricsService metrics;

    public PostalLookupService(LocationIndexClient indexClient, CacheConfig cacheConfig, Ticker ticker,
                               MetricsService metrics) {
        this.indexClient = Objects.requireNonNull(indexClient, "indexClient is required");
        this.metrics = metrics;
        this.postalCache = CaffeineLookupCache.create("postal-lookup", cacheConfig, ticker, metrics);
        this.cityCache = CaffeineLookupCache.create("city-lookup", cacheConfig, ticker, metrics);
        this.regionCache = CaffeineLookupCache.create("region-lookup", cacheConfig, ticker, metrics);
    }

    /**
     * Looks up the places carrying a postal code.
     *
     * @param postalCode postal code as typed
     * @param country    ISO code or English name; null means Germany
     */
    public CompletableFuture<List<PostalCodeLookupResult>> lookupByPostalCode(String postalCode, String country) {
        if (postalCode == null || postalCode.isBlank()) {
            return CompletableFuture.completedFuture(List.of());
        }
        String countryCode = resolveCountry(country);
        String query = postalCode.trim();
        return cached("postal-lookup", postalCache, LookupKey.of(query, countryCode), query, countryCode,
                () -> indexClient.postalLookup(query, countryCode, POSTAL_LIMIT),
                rows -> rows.stream().map(row -> toPostalResult(row, countryCode)).toList());
    }

    /**
     * Looks up a city and lists its postal codes. Rows sharing city and region
     * form one result.
     */
    public CompletableFuture<List<CityLookupResult>> lookupByCity(String city, String country) {
        if (city == null || city.isBlank()) {
            return CompletableFuture.completedFuture(List.of());
        }
        String countryCode = resolveCountry(country);
        String query = city.trim();
        return cached("city-lookup", cityCache, LookupKey.of(query, countryCode), query, countryCode,
                () -> indexClient.cityLookup(query, countryCode, CITY_LIMIT),
                rows -> groupCities(rows, countryCode));
    }

    /**
     * Summarizes a region. When the region index has nothing, rows of the city
     * index whose region contains the query stand in.
     */
    public CompletableFuture<List<RegionLookupResult>> lookupByRegion(String region, String country) {
        if (region == null || region.isBlank()) {
            return CompletableFuture.completedFuture(List.of());
        }
        String countryCode = resolveCountry(country);
        String query = region.trim();
        return cached("region-lookup", regionCache, LookupKey.of(query, countryCode), query, countryCode,
                () -> indexClient.regionLookup(query, countryCode, REGION_LIMIT)
                        .thenCompose(outcome -> {
                            if (outcome.isOk() && !outcome.value().isEmpty()) {
                                return CompletableFuture.completedFuture(outcome);
                            }
                            log.debug("Region index had no rows for '{}' ({}), falling back to city index",
                                    query, outcome.status());
                            return cityFallback(query, countryCode);
                        }),
                rows -> groupRegions(rows, countryCode));
    }

    /**
     * Runs both the postal code and the city lookup. Input shaped like a postal
     * code is looked up as one first.
     */
    public CompletableFuture<SmartLookupResult> smartLookup(String input, String country) {
        if (input == null || input.isBlank()) {
            return CompletableFuture.completedFuture(new SmartLookupResult(List.of(), List.of()));
        }
        String trimmed = input.trim();
        if (looksLikePostalCode(trimmed)) {
            return lookupByPostalCode(trimmed, country)
                    .thenCompose(postal -> lookupByCity(trimmed, country)
                            .thenApply(cities -> new SmartLookupResult(postal, cities)));
        }
        return lookupByCity(trimmed, country)
                .thenCompose(cities -> lookupByPostalCode(trimmed, country)
                        .thenApply(postal -> new SmartLookupResult(postal, cities)));
    }

    public boolean validatePostalCode(String postalCode, String country) {
        return PostalCodes.validate(postalCode, resolveCountry(country));
    }

    public String formatPostalCode(String postalCode, String country) {
        return PostalCodes.format(postalCode, resolveCountry(country));
    }

    public void clearCache() {
        postalCache.invalidateAll();
        cityCache.invalidateAll();
        regionCache.invalidateAll();
    }

    /**
     * Combined statistics of the three lookup caches.
     */
    public CacheStats cacheStats() {
        return CacheStats.combined("lookup",
                postalCache.getStats(), cityCache.getStats(), regionCache.getStats());
    }

    static boolean looksLikePostalCode(String input) {
        return POSTAL_LIKE.matcher(input).matches();
    }

    static String resolveCountry(String country) {
        if (country == null || country.isBlank()) {
            return DEFAULT_COUNTRY;
        }
        return CountryRegistry.resolveCode(country).orElse(country.trim().toUpperCase(Locale.ROOT));
    }

    private <T> CompletableFuture<List<T>> cached(String operation, LookupCache<LookupKey, List<T>> cache,
                                                  LookupKey key, String query, String countryCode,
                                                  Supplier<CompletableFuture<LookupOutcome<List<IndexRow>>>> fetch,
                                                  Function<List<IndexRow>, List<T>> assemble) {
        Optional<List<T>> hit = cache.get(key);
        if (hit.isPresent()) {
            return CompletableFuture.completedFuture(hit.get());
        }
        long start = System.nanoTime();
        CompletableFuture<LookupOutcome<List<IndexRow>>> call;
        try {
            call = fetch.get();
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        return call.handle((outcome, error) -> {
            LookupOutcome<List<IndexRow>> resolved = error != null
                    ? LookupOutcome.unavailable(error.toString())
                    : outcome;
            try (LogContext ctx = LogContext.forLookup(LogContext.generateCorrelationId(),
                    operation, query, countryCode)) {
                metrics.recordLookupDuration(operation, resolved.status(),
                        Duration.ofNanos(System.nanoTime() - start));
                if (resolved.isFailure()) {
                    metrics.recordUpstreamFailure(operation, resolved.status());
                    log.warn("Lookup failed: {} ({})", resolved.status(), resolved.reason());
                    return List.<T>of();
                }
                List<T> results = assemble.apply(resolved.orElse(List.of()));
                if (resolved.isOk()) {
                    cache.put(key, results);
                }
                log.debug("Lookup returned {} results", results.size());
                return results;
            }
        });
    }

    private CompletableFuture<LookupOutcome<List<IndexRow>>> cityFallback(String region, String countryCode) {
        String needle = region.toLowerCase(Locale.ROOT);
        return indexClient.cityLookup(region, countryCode, REGION_LIMIT)
                .thenApply(outcome -> outcome.map(rows -> rows.stream()
                        .filter(row -> row.region() != null
                                && row.region().toLowerCase(Locale.ROOT).contains(needle))
                        .toList()));
    }

    private static PostalCodeLookupResult toPostalResult(IndexRow row, String requestedCountry) {
        String countryCode = countryCodeOf(row, requestedCountry);
        String country = CountryRegistry.nameOf(countryCode);
        String city = row.cityOrName();
        return new PostalCodeLookupResult(
                row.postalCode(),
                city,
                row.region(),
                row.district(),
                country,
                countryCode,
                row.coordinates(),
                row.confidence() != null ? row.confidence() : POSTAL_CONFIDENCE,
                displayName(row.postalCode(), city, row.region(), country)
        );
    }

    private static List<CityLookupResult> groupCities(List<IndexRow> rows, String requestedCountry) {
        Map<String, List<IndexRow>> groups = new LinkedHashMap<>();
        for (IndexRow row : rows) {
            String key = row.cityOrName() + "|" + row.region();
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }

        List<CityLookupResult> results = new ArrayList<>(groups.size());
        for (List<IndexRow> group : groups.values()) {
            IndexRow first = group.get(0);
            String countryCode = countryCodeOf(first, requestedCountry);
            String country = CountryRegistry.nameOf(countryCode);
            List<String> postalCodes = group.stream()
                    .map(IndexRow::postalCode)
                    .filter(Objects::nonNull)
                    .distinct()
                    .sorted()
                    .toList();
            results.add(new CityLookupResult(
                    first.cityOrName(),
                    postalCodes,
                    first.region(),
                    first.district(),
                    country,
                    countryCode,
                    first.coordinates(),
                    first.confidence() != null ? first.confidence() : CITY_CONFIDENCE,
                    displayName(postalCodes.isEmpty() ? null : postalCodes.get(0),
                            first.cityOrName(), first.region(), country)
            ));
        }
        return results;
    }

    private static List<RegionLookupResult> groupRegions(List<IndexRow> rows, String requestedCountry) {
        Map<String, List<IndexRow>> groups = new LinkedHashMap<>();
        for (IndexRow row : rows) {
            String region = row.region() != null ? row.region() : UNKNOWN_REGION;
            groups.computeIfAbsent(region, k -> new ArrayList<>()).add(row);
        }

        List<RegionLookupResult> results = new ArrayList<>(groups.size());
        groups.forEach((region, group) -> {
            String countryCode = countryCodeOf(group.get(0), requestedCountry);
            List<String> cities = group.stream()
                    .map(IndexRow::cityOrName)
                    .filter(Objects::nonNull)
                    .distinct()
                    .sorted()
                    .toList();
            List<String> postalCodes = group.stream()
                    .map(IndexRow::postalCode)
                    .filter(Objects::nonNull)
                    .distinct()
                    .sorted()
                    .toList();
            results.add(new RegionLookupResult(
                    region,
                    cities,
                    PostalCodeRanges.summarize(postalCodes),
                    CountryRegistry.nameOf(countryCode),
                    countryCode,
                    centroid(group),
                    REGION_CONFIDENCE
            ));
        });
        return results;
    }

    static GeographicCoordinates centroid(List<IndexRow> rows) {
        double lat = rows.stream().mapToDouble(r -> r.coordinates().lat()).average().orElse(0.0);
        double lng = rows.stream().mapToDouble(r -> r.coordinates().lng()).average().orElse(0.0);
        return new GeographicCoordinates(lat, lng);
    }

    /**
     * {@code postalCode, city[, region][, country]}; the region is left out when it
     * repeats the city and the country for the four home markets.
     */
    static String displayName(String postalCode, String city, String region, String country) {
        List<String> parts = new ArrayList<>(4);
        if (postalCode != null) {
            parts.add(postalCode);
        }
        if (city != null) {
            parts.add(city);
        }
        if (region != null && !region.equals(city)) {
            parts.add(region);
        }
        if (country != null && !country.isEmpty() && !HOME_MARKETS.contains(country)) {
            parts.add(country);
        }
        return String.join(", ", parts);
    }

    private static String countryCodeOf(IndexRow row, String requestedCountry) {
        if (row.countryCode() == null) {
            return requestedCountry;
        }
        return CountryRegistry.resolveCode(row.countryCode()).orElse(row.countryCode());
    }
}
