package com.location.resolution.cache;

import java.util.Locale;
import java.util.Objects;

/**
 * Point-in-time counters of one lookup cache, or of several caches summed
 * under a common name.
 *
 * @param cacheName     cache the counters belong to
 * @param hitCount      lookups answered from the cache
 * @param missCount     lookups that went upstream
 * @param evictionCount entries dropped by size or TTL
 * @param size          entries currently held
 */
public record CacheStats(String cacheName, long hitCount, long missCount, long evictionCount, long size) {

    public CacheStats {
        Objects.requireNonNull(cacheName, "cacheName is required");
    }

    public static CacheStats empty(String cacheName) {
        return new CacheStats(cacheName, 0, 0, 0, 0);
    }

    public long requestCount() {
        return hitCount + missCount;
    }

    /**
     * Share of lookups answered from the cache, 0.0 when nothing was looked up.
     */
    public double hitRate() {
        long requests = requestCount();
        return requests == 0 ? 0.0 : (double) hitCount / requests;
    }

    /**
     * Sums the counters of several caches, e.g. the postal, city and region
     * caches of the lookup service.
     */
    public static CacheStats combined(String cacheName, CacheStats... parts) {
        long hits = 0;
        long misses = 0;
        long evictions = 0;
        long size = 0;
        for (CacheStats part : parts) {
            hits += part.hitCount;
            misses += part.missCount;
            evictions += part.evictionCount;
            size += part.size;
        }
        return new CacheStats(cacheName, hits, misses, evictions, size);
    }

    /**
     * One-line form for log output: {@code nearby: 12 entries, 75.0% hits of 40}.
     */
    public String summary() {
        return String.format(Locale.ROOT, "%s: %d entries, %.1f%% hits of %d",
                cacheName, size, hitRate() * 100, requestCount());
    }
}
