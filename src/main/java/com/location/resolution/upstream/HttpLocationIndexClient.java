package com.location.resolution.upstream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.location.resolution.core.model.GeographicCoordinates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * JSON-over-HTTP client of the location index.
 *
 * Usage:
 * <pre>
 * LocationIndexClient index = HttpLocationIndexClient.builder()
 *     .config(UpstreamConfig.forIndex("https://example.org/api"))
 *     .build();
 * </pre>
 *
 * Every response is expected as {@code {"results": [ ... ]}}. Rows that fail to
 * parse are skipped; a body that is not JSON, or lacks the results array, is
 * reported as {@link LookupOutcome.Status#MALFORMED}.
 */
public class HttpLocationIndexClient implements LocationIndexClient {
    private static final Logger log = LoggerFactory.getLogger(HttpLocationIndexClient.class);

    private final UpstreamConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private HttpLocationIndexClient(Builder builder) {
        this.config = builder.config;
        this.httpClient = builder.httpClient != null ? builder.httpClient : HttpClient.newBuilder()
                .connectTimeout(config.timeout())
                .build();
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
    }

    @Override
    public CompletableFuture<LookupOutcome<List<IndexRow>>> nearby(GeographicCoordinates center, double radiusKm,
                                                                   String countryCode, int limit) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("lat", Double.toString(center.lat()));
        params.put("lng", Double.toString(center.lng()));
        params.put("radius", formatNumber(radiusKm));
        params.put("country", countryCode);
        params.put("limit", Integer.toString(limit));
        return fetchRows("/locations/nearby", params);
    }

    @Override
    public CompletableFuture<LookupOutcome<List<IndexRow>>> postalLookup(String postalCode, String countryCode,
                                                                         int limit) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("postal_code", postalCode);
        params.put("country", countryCode);
        params.put("limit", Integer.toString(limit));
        return fetchRows("/locations/postal-lookup", params);
    }

    @Override
    public CompletableFuture<LookupOutcome<List<IndexRow>>> cityLookup(String city, String countryCode, int limit) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("city", city);
        params.put("country", countryCode);
        params.put("limit", Integer.toString(limit));
        return fetchRows("/locations/city-lookup", params);
    }

    @Override
    public CompletableFuture<LookupOutcome<List<IndexRow>>> regionLookup(String region, String countryCode,
                                                                         int limit) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("region", region);
        params.put("country", countryCode);
        params.put("limit", Integer.toString(limit));
        return fetchRows("/locations/region-lookup", params);
    }

    /**
     * Issues a GET request and parses the {@code results} array.
     */
    CompletableFuture<LookupOutcome<List<IndexRow>>> fetchRows(String path, Map<String, String> params) {
        URI uri = URI.create(config.baseUrl() + path + "?" + queryString(params));
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(config.timeout())
                .header("Accept", "application/json")
                .header("User-Agent", config.userAgent())
                .GET()
                .build();

        log.debug("Calling location index: {}", uri);

        CompletableFuture<HttpResponse<String>> response;
        try {
            response = httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        } catch (RuntimeException e) {
            log.warn("Location index request could not be sent: {}", e.getMessage());
            return CompletableFuture.completedFuture(LookupOutcome.unavailable(e.getMessage()));
        }

        return response
                .thenApply(this::parseResponse)
                .exceptionally(e -> {
                    Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                    log.warn("Location index call failed for {}: {}", path, cause.toString());
                    if (cause instanceof LocationIndexException lie) {
                        return new LookupOutcome<>(lie.getStatus(), null, lie.getMessage());
                    }
                    return LookupOutcome.unavailable(cause.toString());
                });
    }

    private LookupOutcome<List<IndexRow>> parseResponse(HttpResponse<String> response) {
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new LocationIndexException(LookupOutcome.Status.UPSTREAM_UNAVAILABLE,
                    "Location index returned status " + response.statusCode());
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new LocationIndexException(LookupOutcome.Status.MALFORMED,
                    "Location index returned invalid JSON", e);
        }

        JsonNode results = root != null ? root.get("results") : null;
        if (results == null || !results.isArray()) {
            throw new LocationIndexException(LookupOutcome.Status.MALFORMED,
                    "Location index response has no results array");
        }

        List<IndexRow> rows = new ArrayList<>(results.size());
        int skipped = 0;
        for (JsonNode node : results) {
            Optional<IndexRow> row = IndexRow.parse(node);
            if (row.isPresent()) {
                rows.add(row.get());
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.debug("Skipped {} malformed location index rows", skipped);
        }
        return LookupOutcome.ok(rows);
    }

    private static String queryString(Map<String, String> params) {
        return params.entrySet().stream()
                .filter(e -> e.getValue() != null)
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }

    private static String formatNumber(double value) {
        if (value == Math.rint(value)) {
            return Long.toString((long) value);
        }
        return String.format(Locale.ROOT, "%s", value);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private UpstreamConfig config;
        private HttpClient httpClient;
        private ObjectMapper objectMapper;

        public Builder config(UpstreamConfig config) {
            this.config = config;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.config = UpstreamConfig.forIndex(baseUrl);
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

        public HttpLocationIndexClient build() {
            if (config == null) {
                throw new IllegalStateException("config or baseUrl is required");
            }
            return new HttpLocationIndexClient(this);
        }
    }
}
