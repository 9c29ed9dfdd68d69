package com.location.resolution.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <p>MDC is thread-bound: entries cover the calling thread only, not the
 * continuation stages of an asynchronous lookup.</p>
 *
 * <pre>
 * try (LogContext ctx = LogContext.forGeocode(LogContext.generateCorrelationId(), "munich")) {
 *     log.info("location.geocode source={} confidence={}", source, confidence);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for geocoding operations.
     */
    public static LogContext forGeocode(String correlationId, String query) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("query", query);
        ctx.put("operation", "geocode");
        return ctx;
    }

    /**
     * Creates a log context for postal/city/region lookups.
     */
    public static LogContext forLookup(String correlationId, String operation, String query, String country) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", operation);
        ctx.put("query", query);
        ctx.put("country", country);
        return ctx;
    }

    /**
     * Creates a log context for nearby searches.
     */
    public static LogContext forNearbySearch(String correlationId, double lat, double lng, double radiusKm) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", "nearby");
        ctx.put("center", lat + "," + lng);
        ctx.put("radiusKm", Double.toString(radiusKm));
        return ctx;
    }

    /**
     * Generates a unique correlation ID.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
