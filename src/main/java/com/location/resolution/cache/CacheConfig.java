package com.location.resolution.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for a lookup cache.
 *
 * @param maxSize maximum number of entries
 * @param ttl     time-to-live of each entry, measured from the write
 * @param enabled whether caching is enabled
 */
public record CacheConfig(int maxSize, Duration ttl, boolean enabled) {

    public CacheConfig {
        Objects.requireNonNull(ttl, "ttl is required");
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
    }

    /**
     * Default cache configuration: 10,000 entries, 300s TTL, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, Duration.ofSeconds(300), true);
    }

    /**
     * Geocoding results: store data never changes at runtime, so entries live for a day.
     */
    public static CacheConfig geocoding() {
        return new CacheConfig(10_000, Duration.ofHours(24), true);
    }

    /**
     * Nearby search results: 5 minutes.
     */
    public static CacheConfig nearby() {
        return new CacheConfig(1_000, Duration.ofMinutes(5), true);
    }

    /**
     * Postal/city/region lookups: 10 minutes.
     */
    public static CacheConfig lookup() {
        return new CacheConfig(5_000, Duration.ofMinutes(10), true);
    }

    /**
     * Disabled cache configuration.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(1, Duration.ofSeconds(1), false);
    }
}
