package com.location.resolution.metrics;

import com.location.resolution.upstream.LookupOutcome;

import java.time.Duration;

/**
 * Interface for recording location resolution metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordLookupDuration(String operation, LookupOutcome.Status status, Duration duration);

    void recordCacheHit(String cacheName);

    void recordCacheMiss(String cacheName);

    void recordUpstreamFailure(String component, LookupOutcome.Status status);

    void recordConfidence(double confidence);

    void recordNearbyResults(int count);
}
