package com.location.resolution.metrics;

import com.location.resolution.upstream.LookupOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordLookupDuration("geocode", LookupOutcome.Status.OK, Duration.ofMillis(5));
                noOp.recordCacheHit("geocoding");
                noOp.recordCacheMiss("geocoding");
                noOp.recordUpstreamFailure("nearby", LookupOutcome.Status.MALFORMED);
                noOp.recordConfidence(0.9);
                noOp.recordNearbyResults(12);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record lookup duration per operation and status")
        void lookupDuration() {
            metrics.recordLookupDuration("geocode", LookupOutcome.Status.OK, Duration.ofMillis(15));
            metrics.recordLookupDuration("geocode", LookupOutcome.Status.OK, Duration.ofMillis(25));
            metrics.recordLookupDuration("geocode", LookupOutcome.Status.NOT_FOUND, Duration.ofMillis(40));

            Timer ok = registry.find("location.lookup.duration")
                    .tag("operation", "geocode")
                    .tag("status", "OK")
                    .timer();

            assertNotNull(ok);
            assertEquals(2, ok.count());
            assertEquals(1, registry.find("location.lookup.duration").tag("status", "NOT_FOUND").timer().count());
        }

        @Test
        @DisplayName("Should count cache hits and misses per cache")
        void cacheCounters() {
            metrics.recordCacheHit("geocoding");
            metrics.recordCacheHit("geocoding");
            metrics.recordCacheMiss("nearby");

            Counter hits = registry.find("location.cache.hit").tag("cache", "geocoding").counter();
            Counter misses = registry.find("location.cache.miss").tag("cache", "nearby").counter();

            assertEquals(2.0, hits.count());
            assertEquals(1.0, misses.count());
            assertNull(registry.find("location.cache.hit").tag("cache", "nearby").counter());
        }

        @Test
        @DisplayName("Should count upstream failures by component and status")
        void upstreamFailures() {
            metrics.recordUpstreamFailure("nearby", LookupOutcome.Status.UPSTREAM_UNAVAILABLE);
            metrics.recordUpstreamFailure("nearby", LookupOutcome.Status.MALFORMED);
            metrics.recordUpstreamFailure("nearby", LookupOutcome.Status.MALFORMED);

            assertEquals(2.0, registry.find("location.upstream.failure")
                    .tag("component", "nearby").tag("status", "MALFORMED").counter().count());
        }

        @Test
        @DisplayName("Should record confidence and nearby result distributions")
        void summaries() {
            metrics.recordConfidence(0.8);
            metrics.recordConfidence(1.0);
            metrics.recordNearbyResults(7);

            DistributionSummary confidence = registry.find("location.geocode.confidence").summary();
            assertEquals(2, confidence.count());
            assertEquals(0.9, confidence.mean(), 1e-9);
            assertEquals(7.0, registry.find("location.nearby.results").summary().totalAmount());
        }
    }
}
