package com.location.resolution.cache;

import java.util.Optional;

/**
 * No-op cache implementation. All operations are no-ops.
 * Used when caching is disabled.
 */
public class NoOpLookupCache<K, V> implements LookupCache<K, V> {

    @Override
    public Optional<V> get(K key) {
        return Optional.empty();
    }

    @Override
    public void put(K key, V value) {
        // no-op
    }

    @Override
    public void invalidate(K key) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public void cleanUp() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty("no-op");
    }
}
