package com.location.resolution.metrics;

import com.location.resolution.upstream.LookupOutcome;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordLookupDuration(String operation, LookupOutcome.Status status, Duration duration) {
    }

    @Override
    public void recordCacheHit(String cacheName) {
    }

    @Override
    public void recordCacheMiss(String cacheName) {
    }

    @Override
    public void recordUpstreamFailure(String component, LookupOutcome.Status status) {
    }

    @Override
    public void recordConfidence(double confidence) {
    }

    @Override
    public void recordNearbyResults(int count) {
    }
}
