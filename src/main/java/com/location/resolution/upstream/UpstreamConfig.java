package com.location.resolution.upstream;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings for an HTTP collaborator.
 *
 * @param baseUrl   base URL without a trailing slash
 * @param timeout   connect and request timeout
 * @param userAgent value of the User-Agent header
 */
public record UpstreamConfig(String baseUrl, Duration timeout, String userAgent) {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    private static final String DEFAULT_USER_AGENT = "location-resolution/1.0";

    public UpstreamConfig {
        Objects.requireNonNull(baseUrl, "baseUrl is required");
        baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
        userAgent = userAgent != null ? userAgent : DEFAULT_USER_AGENT;
    }

    /**
     * Public OpenStreetMap Nominatim instance.
     */
    public static UpstreamConfig nominatimDefaults() {
        return new UpstreamConfig("https://nominatim.openstreetmap.org", DEFAULT_TIMEOUT, DEFAULT_USER_AGENT);
    }

    /**
     * Location index served under {@code baseUrl} (for example {@code https://host/api}).
     */
    public static UpstreamConfig forIndex(String baseUrl) {
        return new UpstreamConfig(baseUrl, DEFAULT_TIMEOUT, DEFAULT_USER_AGENT);
    }
}
