package com.location.resolution.api;

import com.github.benmanes.caffeine.cache.Ticker;
import com.location.resolution.cache.CacheConfig;
import com.location.resolution.cache.CacheStats;
import com.location.resolution.cache.CaffeineLookupCache;
import com.location.resolution.core.model.CityLookupResult;
import com.location.resolution.core.model.GeocodingResult;
import com.location.resolution.core.model.GeographicCoordinates;
import com.location.resolution.core.model.LocationSearchResult;
import com.location.resolution.core.model.MapBounds;
import com.location.resolution.core.model.MapLocation;
import com.location.resolution.core.model.MapLocationType;
import com.location.resolution.core.model.NearbySearchResult;
import com.location.resolution.core.model.NearbyWithMain;
import com.location.resolution.core.model.PostalCodeLookupResult;
import com.location.resolution.core.model.RegionLookupResult;
import com.location.resolution.core.model.SmartLookupResult;
import com.location.resolution.geo.GeoMath;
import com.location.resolution.geocoding.ExternalGeocoder;
import com.location.resolution.geocoding.GeocodingOptions;
import com.location.resolution.geocoding.GeocodingResolver;
import com.location.resolution.geocoding.NoOpExternalGeocoder;
import com.location.resolution.geocoding.NominatimGeocoder;
import com.location.resolution.lookup.PostalLookupService;
import com.location.resolution.matching.StaticMatcher;
import com.location.resolution.metrics.MetricsService;
import com.location.resolution.metrics.NoOpMetricsService;
import com.location.resolution.nearby.NearbySearchEngine;
import com.location.resolution.nearby.NearbySearchOptions;
import com.location.resolution.store.JsonLocationStoreLoader;
import com.location.resolution.store.LocationStore;
import com.location.resolution.upstream.HttpLocationIndexClient;
import com.location.resolution.upstream.LocationIndexClient;
import com.location.resolution.upstream.UpstreamConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Main entry point for location resolution.
 * Wires the in-memory store, the external geocoder and the location index
 * behind one fluent API.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * LocationResolver resolver = LocationResolver.builder()
 *     .locationIndex("https://index.example.com")
 *     .nominatim()
 *     .build();
 *
 * Optional&lt;GeocodingResult&gt; berlin = resolver.geocode("Berlin").join();
 *
 * NearbySearchResult around = resolver.searchNearby(
 *     NearbySearchOptions.around(berlin.get().coordinates(), 10)).join();
 *
 * List&lt;CityLookupResult&gt; codes = resolver.lookupByCity("Nagold", "DE").join();
 * </pre>
 *
 * <p>Network operations return futures that never complete exceptionally:
 * an unknown place and an unreachable upstream both surface as an empty result.</p>
 */
public class LocationResolver {
    private static final Logger log = LoggerFactory.getLogger(LocationResolver.class);

    static final double DEFAULT_NEARBY_RADIUS_KM = 25.0;
    static final int DEFAULT_MAX_NEARBY = 20;

    private final LocationStore store;
    private final GeocodingResolver geocodingResolver;
    private final NearbySearchEngine nearbySearchEngine;
    private final PostalLookupService lookupService;
    private final MetricsService metricsService;

    private LocationResolver(Builder builder) {
        this.store = builder.store != null ? builder.store : JsonLocationStoreLoader.loadDefault();
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();

        ExternalGeocoder externalGeocoder = builder.externalGeocoder != null
                ? builder.externalGeocoder : new NoOpExternalGeocoder();

        StaticMatcher matcher = new StaticMatcher(store);
        this.geocodingResolver = new GeocodingResolver(matcher, externalGeocoder,
                CaffeineLookupCache.create("geocoding", builder.geocodingCache, builder.ticker, metricsService),
                metricsService);

        this.nearbySearchEngine = new NearbySearchEngine(builder.indexClient,
                CaffeineLookupCache.create("nearby", builder.nearbyCache, builder.ticker, metricsService),
                metricsService);

        this.lookupService = new PostalLookupService(builder.indexClient, builder.lookupCache,
                builder.ticker, metricsService);

        log.info("LocationResolver initialized: {} store locations, geocoder={}",
                store.size(), externalGeocoder.getProviderName());
    }

    // ========== Geocoding API ==========

    /**
     * Resolves a free-text place name to coordinates and hierarchy.
     */
    public CompletableFuture<Optional<GeocodingResult>> geocode(String name) {
        return geocodingResolver.geocode(name);
    }

    /**
     * Resolves a place name with custom options.
     */
    public CompletableFuture<Optional<GeocodingResult>> geocode(String name, GeocodingOptions options) {
        return geocodingResolver.geocode(name, options);
    }

    /**
     * Autocomplete over the in-memory store. Queries shorter than two
     * characters return nothing.
     */
    public List<LocationSearchResult> search(String query) {
        return search(query, StaticMatcher.DEFAULT_LIMIT);
    }

    public List<LocationSearchResult> search(String query, int limit) {
        return geocodingResolver.search(query, limit);
    }

    // ========== Nearby API ==========

    public CompletableFuture<NearbySearchResult> searchNearby(NearbySearchOptions options) {
        return nearbySearchEngine.searchNearby(options);
    }

    public CompletableFuture<NearbyWithMain> geocodeWithNearby(String name) {
        return geocodeWithNearby(name, DEFAULT_NEARBY_RADIUS_KM, DEFAULT_MAX_NEARBY);
    }

    /**
     * Geocodes a place and lists what lies around it. The bounds frame the
     * place together with its neighbours. An unknown place yields
     * {@link NearbyWithMain#empty()}.
     */
    public CompletableFuture<NearbyWithMain> geocodeWithNearby(String name, double radiusKm, int maxNearby) {
        return geocodingResolver.geocode(name)
                .thenCompose(resolved -> {
                    if (resolved.isEmpty()) {
                        return CompletableFuture.completedFuture(NearbyWithMain.empty());
                    }
                    MapLocation main = toMainLocation(name, resolved.get());
                    NearbySearchOptions options = NearbySearchOptions.builder()
                            .center(main.coordinates())
                            .radiusKm(radiusKm)
                            .maxResults(maxNearby)
                            .build();
                    return nearbySearchEngine.searchNearby(options)
                            .thenApply(nearby -> {
                                List<GeographicCoordinates> framed = new ArrayList<>();
                                framed.add(main.coordinates());
                                nearby.locations().forEach(l -> framed.add(l.coordinates()));
                                return new NearbyWithMain(Optional.of(main), nearby.locations(),
                                        GeoMath.bounds(framed));
                            });
                });
    }

    /**
     * Finds the closest known location within 5 km of the point.
     */
    public CompletableFuture<Optional<MapLocation>> reverseGeocode(GeographicCoordinates coordinates) {
        return nearbySearchEngine.reverseGeocode(coordinates);
    }

    // ========== Lookup API ==========

    public CompletableFuture<List<PostalCodeLookupResult>> lookupByPostalCode(String postalCode, String country) {
        return lookupService.lookupByPostalCode(postalCode, country);
    }

    public CompletableFuture<List<CityLookupResult>> lookupByCity(String city, String country) {
        return lookupService.lookupByCity(city, country);
    }

    public CompletableFuture<List<RegionLookupResult>> lookupByRegion(String region, String country) {
        return lookupService.lookupByRegion(region, country);
    }

    public CompletableFuture<SmartLookupResult> smartLookup(String input, String country) {
        return lookupService.smartLookup(input, country);
    }

    public boolean validatePostalCode(String postalCode, String country) {
        return lookupService.validatePostalCode(postalCode, country);
    }

    public String formatPostalCode(String postalCode, String country) {
        return lookupService.formatPostalCode(postalCode, country);
    }

    // ========== Geometry ==========

    public double distance(GeographicCoordinates a, GeographicCoordinates b) {
        return GeoMath.distance(a, b);
    }

    public MapBounds bounds(List<GeographicCoordinates> points) {
        return GeoMath.bounds(points);
    }

    public int optimalZoom(double radiusKm) {
        return GeoMath.optimalZoom(radiusKm);
    }

    // ========== Cache Management ==========

    /**
     * Clears the geocoding, nearby and lookup caches.
     */
    public void clearCaches() {
        log.info("Clearing location caches [{}; {}; {}]", geocodingCacheStats().summary(),
                nearbyCacheStats().summary(), lookupCacheStats().summary());
        geocodingResolver.clearCache();
        nearbySearchEngine.clearCache();
        lookupService.clearCache();
        log.info("All location caches cleared");
    }

    public CacheStats geocodingCacheStats() {
        return geocodingResolver.cacheStats();
    }

    public CacheStats nearbyCacheStats() {
        return nearbySearchEngine.cacheStats();
    }

    public CacheStats lookupCacheStats() {
        return lookupService.cacheStats();
    }

    // ========== Service Access ==========

    public LocationStore getStore() {
        return store;
    }

    public GeocodingResolver getGeocodingResolver() {
        return geocodingResolver;
    }

    public NearbySearchEngine getNearbySearchEngine() {
        return nearbySearchEngine;
    }

    public PostalLookupService getLookupService() {
        return lookupService;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    static MapLocation toMainLocation(String name, GeocodingResult result) {
        return new MapLocation(
                "main-" + name,
                result.hierarchy().city() != null ? result.hierarchy().city() : name,
                result.coordinates(),
                result.hierarchy().postalCode(),
                result.hierarchy().countryCode(),
                result.hierarchy().region(),
                result.hierarchy().district(),
                MapLocationType.SEARCH,
                null,
                result.confidence()
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private LocationStore store;
        private ExternalGeocoder externalGeocoder;
        private LocationIndexClient indexClient;
        private CacheConfig geocodingCache = CacheConfig.geocoding();
        private CacheConfig nearbyCache = CacheConfig.nearby();
        private CacheConfig lookupCache = CacheConfig.lookup();
        private Ticker ticker = Ticker.systemTicker();
        private MetricsService metricsService;

        /**
         * Sets the in-memory store. Defaults to the bundled German locations.
         */
        public Builder store(LocationStore store) {
            this.store = store;
            return this;
        }

        /**
         * Sets the external geocoder consulted on store misses.
         * Defaults to {@link NoOpExternalGeocoder} if not set.
         */
        public Builder externalGeocoder(ExternalGeocoder externalGeocoder) {
            this.externalGeocoder = externalGeocoder;
            return this;
        }

        /**
         * Uses the public OpenStreetMap Nominatim instance as external geocoder.
         */
        public Builder nominatim() {
            this.externalGeocoder = NominatimGeocoder.createDefault();
            return this;
        }

        /**
         * Uses a Nominatim instance described by the given configuration.
         */
        public Builder nominatim(UpstreamConfig config) {
            this.externalGeocoder = NominatimGeocoder.builder().config(config).build();
            return this;
        }

        /**
         * Sets the location index client used by nearby search and lookups.
         */
        public Builder indexClient(LocationIndexClient indexClient) {
            this.indexClient = indexClient;
            return this;
        }

        /**
         * Creates an HTTP client for the location index at the given base URL.
         */
        public Builder locationIndex(String baseUrl) {
            this.indexClient = HttpLocationIndexClient.builder()
                    .config(UpstreamConfig.forIndex(baseUrl))
                    .build();
            return this;
        }

        public Builder geocodingCache(CacheConfig config) {
            this.geocodingCache = config;
            return this;
        }

        public Builder nearbyCache(CacheConfig config) {
            this.nearbyCache = config;
            return this;
        }

        public Builder lookupCache(CacheConfig config) {
            this.lookupCache = config;
            return this;
        }

        /**
         * Sets the time source of every cache. Tests pass a manual ticker.
         */
        public Builder ticker(Ticker ticker) {
            this.ticker = ticker;
            return this;
        }

        /**
         * Sets a custom metrics service for recording operational metrics.
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public LocationResolver build() {
            if (indexClient == null) {
                throw new IllegalStateException("LocationIndexClient is required");
            }
            return new LocationResolver(this);
        }
    }
}
