package com.location.resolution.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Scheduler;
import com.github.benmanes.caffeine.cache.Ticker;
import com.location.resolution.metrics.MetricsService;
import com.location.resolution.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Caffeine-backed lookup cache with write-based expiry.
 *
 * <p>Expired entries are never returned: Caffeine checks expiry on every read against
 * the configured {@link Ticker}, and its maintenance cycle sweeps expired entries.
 * With the system ticker a system scheduler is attached so the sweep also runs
 * when the cache is idle. Tests pass a manual ticker to control time.</p>
 */
public class CaffeineLookupCache<K, V> implements LookupCache<K, V> {
    private static final Logger log = LoggerFactory.getLogger(CaffeineLookupCache.class);

    private final String name;
    private final Cache<K, V> cache;
    private final MetricsService metrics;

    public CaffeineLookupCache(String name, CacheConfig config) {
        this(name, config, Ticker.systemTicker(), new NoOpMetricsService());
    }

    public CaffeineLookupCache(String name, CacheConfig config, Ticker ticker, MetricsService metrics) {
        this.name = name;
        this.metrics = metrics;
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(config.ttl())
                .ticker(ticker)
                .recordStats();
        if (ticker == Ticker.systemTicker()) {
            builder.scheduler(Scheduler.systemScheduler());
        } else {
            builder.executor(Runnable::run);
        }
        this.cache = builder.build();
        log.info("CaffeineLookupCache '{}' initialized: maxSize={}, ttl={}",
                name, config.maxSize(), config.ttl());
    }

    /**
     * Creates a cache for the configuration, or a no-op cache when it is disabled.
     */
    public static <K, V> LookupCache<K, V> create(String name, CacheConfig config, Ticker ticker,
                                                  MetricsService metrics) {
        if (!config.enabled()) {
            log.info("Cache '{}' disabled", name);
            return new NoOpLookupCache<>();
        }
        return new CaffeineLookupCache<>(name, config, ticker, metrics);
    }

    @Override
    public Optional<V> get(K key) {
        V value = cache.getIfPresent(key);
        if (value != null) {
            metrics.recordCacheHit(name);
            log.debug("Cache '{}' hit: {}", name, key);
        } else {
            metrics.recordCacheMiss(name);
        }
        return Optional.ofNullable(value);
    }

    @Override
    public void put(K key, V value) {
        cache.put(key, value);
    }

    @Override
    public void invalidate(K key) {
        cache.invalidate(key);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all entries of cache '{}'", name);
    }

    @Override
    public void cleanUp() {
        cache.cleanUp();
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                name,
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    public String getName() {
        return name;
    }
}
