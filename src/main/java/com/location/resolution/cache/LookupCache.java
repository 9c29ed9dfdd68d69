package com.location.resolution.cache;

import java.util.Optional;

/**
 * TTL cache for resolution and lookup results.
 * Entries are replaced on write, never patched, and never served past their TTL.
 *
 * @param <K> key type
 * @param <V> value type
 */
public interface LookupCache<K, V> {

    /**
     * Gets a cached value.
     *
     * @return the value, or empty if absent or expired
     */
    Optional<V> get(K key);

    /**
     * Stores a value, replacing any previous entry for the key.
     */
    void put(K key, V value);

    /**
     * Removes a single entry.
     */
    void invalidate(K key);

    /**
     * Removes all entries.
     */
    void invalidateAll();

    /**
     * Drops expired entries now instead of waiting for the next maintenance cycle.
     */
    void cleanUp();

    /**
     * Returns cache statistics.
     */
    CacheStats getStats();
}
