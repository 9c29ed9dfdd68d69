package com.location.resolution.geocoding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.location.resolution.core.model.GeocodingResult;
import com.location.resolution.core.model.GeocodingSource;
import com.location.resolution.core.model.GeographicCoordinates;
import com.location.resolution.core.model.LocationHierarchy;
import com.location.resolution.country.CountryRegistry;
import com.location.resolution.matching.ScoringRuleSet;
import com.location.resolution.upstream.LocationIndexException;
import com.location.resolution.upstream.LookupOutcome;
import com.location.resolution.upstream.UpstreamConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * {@link ExternalGeocoder} backed by a Nominatim-compatible {@code /search} API.
 *
 * Usage:
 * <pre>
 * ExternalGeocoder geocoder = NominatimGeocoder.builder()
 *     .config(UpstreamConfig.nominatimDefaults())
 *     .build();
 * </pre>
 *
 * The public OpenStreetMap instance requires an identifying User-Agent and allows
 * at most one request per second; callers are expected to debounce.
 */
public class NominatimGeocoder implements ExternalGeocoder {
    private static final Logger log = LoggerFactory.getLogger(NominatimGeocoder.class);

    private final UpstreamConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ScoringRuleSet<NominatimPlace> confidenceRules;

    private NominatimGeocoder(Builder builder) {
        this.config = builder.config != null ? builder.config : UpstreamConfig.nominatimDefaults();
        this.httpClient = builder.httpClient != null ? builder.httpClient : HttpClient.newBuilder()
                .connectTimeout(config.timeout())
                .build();
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
        this.confidenceRules = builder.confidenceRules != null ? builder.confidenceRules : ConfidenceRules.defaults();
    }

    @Override
    public CompletableFuture<LookupOutcome<GeocodingResult>> resolve(String freeText, String preferredCountry) {
        if (freeText == null || freeText.isBlank()) {
            return CompletableFuture.completedFuture(LookupOutcome.notFound("Empty query"));
        }
        String query = freeText.trim();
        CompletableFuture<HttpResponse<String>> response;
        try {
            URI uri = buildUri(query, preferredCountry);
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(uri)
                    .timeout(config.timeout())
                    .header("Accept", "application/json")
                    .header("User-Agent", config.userAgent())
                    .GET()
                    .build();

            log.debug("Calling Nominatim: {}", uri);
            response = httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        } catch (RuntimeException e) {
            log.warn("Nominatim request could not be sent: {}", e.getMessage());
            return CompletableFuture.completedFuture(LookupOutcome.unavailable(e.getMessage()));
        }

        return response
                .thenApply(r -> parseResponse(r, query))
                .exceptionally(e -> {
                    Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                    log.warn("Nominatim geocoding failed for '{}': {}", query, cause.toString());
                    if (cause instanceof LocationIndexException lie) {
                        return new LookupOutcome<>(lie.getStatus(), null, lie.getMessage());
                    }
                    return LookupOutcome.unavailable(cause.toString());
                });
    }

    @Override
    public String getProviderName() {
        return "Nominatim/" + config.baseUrl();
    }

    URI buildUri(String query, String preferredCountry) {
        StringBuilder uri = new StringBuilder(config.baseUrl())
                .append("/search?q=").append(URLEncoder.encode(query, StandardCharsets.UTF_8))
                .append("&format=json&limit=1&addressdetails=1&extratags=1");
        Optional<String> countryCode = CountryRegistry.resolveCode(preferredCountry);
        countryCode.ifPresent(code -> uri.append("&countrycodes=").append(code.toLowerCase(Locale.ROOT)));
        return URI.create(uri.toString());
    }

    private LookupOutcome<GeocodingResult> parseResponse(HttpResponse<String> response, String query) {
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new LocationIndexException(LookupOutcome.Status.UPSTREAM_UNAVAILABLE,
                    "Nominatim returned status " + response.statusCode());
        }

        List<NominatimPlace> places;
        try {
            places = objectMapper.readValue(response.body(), new TypeReference<List<NominatimPlace>>() {});
        } catch (JsonProcessingException e) {
            throw new LocationIndexException(LookupOutcome.Status.MALFORMED,
                    "Nominatim returned invalid JSON", e);
        }

        if (places == null || places.isEmpty()) {
            return LookupOutcome.notFound("No Nominatim result for '" + query + "'");
        }
        return toResult(places.get(0), query);
    }

    /**
     * Converts a Nominatim hit into a geocoding result with hierarchy and confidence.
     */
    LookupOutcome<GeocodingResult> toResult(NominatimPlace place, String query) {
        Double lat = parseCoordinate(place.lat());
        Double lng = parseCoordinate(place.lon());
        if (lat == null || lng == null || !GeographicCoordinates.isValid(lat, lng)) {
            return LookupOutcome.malformed("Unparseable coordinates: lat=" + place.lat() + ", lon=" + place.lon());
        }
        GeographicCoordinates coordinates = new GeographicCoordinates(lat, lng);

        LocationHierarchy hierarchy = extractHierarchy(place, coordinates);
        double confidence = confidenceRules.scoreOrDefault(place, query.toLowerCase(Locale.ROOT),
                ConfidenceRules.FLOOR);

        log.debug("Nominatim resolved '{}' to {} ({}), confidence={}",
                query, hierarchy.city(), hierarchy.countryCode(), confidence);

        return LookupOutcome.ok(new GeocodingResult(coordinates, hierarchy, GeocodingSource.EXTERNAL, confidence));
    }

    static LocationHierarchy extractHierarchy(NominatimPlace place, GeographicCoordinates coordinates) {
        String country = place.firstAddress("country");
        String countryCode = place.firstAddress("country_code");
        String region = place.firstAddress("state", "region", "province");
        String city = place.firstAddress("city", "town", "village", "municipality");
        if (city == null) {
            city = place.displayName().split(",")[0].trim();
        }

        return new LocationHierarchy(
                country != null ? country : "Unknown",
                countryCode != null ? countryCode.toUpperCase(Locale.ROOT) : "XX",
                region != null ? region : "",
                place.firstAddress("county", "district"),
                city,
                place.firstAddress("suburb", "neighbourhood"),
                place.firstAddress("village"),
                place.firstAddress("postcode"),
                coordinates,
                parsePopulation(place.extratags().get("population")),
                LocationTypeRules.infer(place)
        );
    }

    private static Double parseCoordinate(String value) {
        if (value == null) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Long parsePopulation(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric population '{}'", value);
            return null;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a geocoder for the public OpenStreetMap instance.
     */
    public static NominatimGeocoder createDefault() {
        return builder().build();
    }

    public static class Builder {
        private UpstreamConfig config;
        private HttpClient httpClient;
        private ObjectMapper objectMapper;
        private ScoringRuleSet<NominatimPlace> confidenceRules;

        public Builder config(UpstreamConfig config) {
            this.config = config;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.config = new UpstreamConfig(baseUrl, null, null);
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder confidenceRules(ScoringRuleSet<NominatimPlace> confidenceRules) {
            this.confidenceRules = confidenceRules;
            return this;
        }

        public NominatimGeocoder build() {
            return new NominatimGeocoder(this);
        }
    }
}
