package com.location.resolution.metrics;

import com.location.resolution.upstream.LookupOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code location.lookup.duration} Timer (tags: operation, status)</li>
 *   <li>{@code location.cache.hit} Counter (tag: cache)</li>
 *   <li>{@code location.cache.miss} Counter (tag: cache)</li>
 *   <li>{@code location.upstream.failure} Counter (tags: component, status)</li>
 *   <li>{@code location.geocode.confidence} DistributionSummary</li>
 *   <li>{@code location.nearby.results} DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary confidenceSummary;
    private final DistributionSummary nearbyResultsSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.confidenceSummary = DistributionSummary.builder("location.geocode.confidence")
                .description("Distribution of geocoding confidence")
                .register(registry);
        this.nearbyResultsSummary = DistributionSummary.builder("location.nearby.results")
                .description("Number of locations returned by nearby searches")
                .register(registry);
    }

    @Override
    public void recordLookupDuration(String operation, LookupOutcome.Status status, Duration duration) {
        String key = operation + ":" + status.name();
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("location.lookup.duration")
                        .description("Duration of location lookups")
                        .tag("operation", operation)
                        .tag("status", status.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordCacheHit(String cacheName) {
        cacheCounter("location.cache.hit", cacheName, "Number of cache hits").increment();
    }

    @Override
    public void recordCacheMiss(String cacheName) {
        cacheCounter("location.cache.miss", cacheName, "Number of cache misses").increment();
    }

    @Override
    public void recordUpstreamFailure(String component, LookupOutcome.Status status) {
        String key = "failure:" + component + ":" + status.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("location.upstream.failure")
                        .description("Number of failed upstream calls")
                        .tag("component", component)
                        .tag("status", status.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordConfidence(double confidence) {
        confidenceSummary.record(confidence);
    }

    @Override
    public void recordNearbyResults(int count) {
        nearbyResultsSummary.record(count);
    }

    private Counter cacheCounter(String name, String cacheName, String description) {
        String key = name + ":" + cacheName;
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("cache", cacheName)
                        .register(registry));
    }
}
