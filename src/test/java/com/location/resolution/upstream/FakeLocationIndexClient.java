package com.location.resolution.upstream;

import com.location.resolution.core.model.GeographicCoordinates;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory location index. Responses are registered per operation and country
 * ({@code "*"} matches any country); unregistered calls answer with no rows.
 */
public class FakeLocationIndexClient implements LocationIndexClient {

    public static final String NEARBY = "nearby";
    public static final String POSTAL = "postal";
    public static final String CITY = "city";
    public static final String REGION = "region";

    public record Call(String operation, String query, String countryCode, int limit) {}

    private final Map<String, LookupOutcome<List<IndexRow>>> responses = new ConcurrentHashMap<>();
    private final Map<String, RuntimeException> failures = new ConcurrentHashMap<>();
    private final List<Call> calls = new CopyOnWriteArrayList<>();

    public FakeLocationIndexClient respond(String operation, String countryCode, List<IndexRow> rows) {
        return respond(operation, countryCode, LookupOutcome.ok(rows));
    }

    public FakeLocationIndexClient respond(String operation, String countryCode,
                                           LookupOutcome<List<IndexRow>> outcome) {
        responses.put(operation + ":" + countryCode, outcome);
        return this;
    }

    /**
     * Completes the matching calls exceptionally, as a broken client would.
     */
    public FakeLocationIndexClient failWith(String operation, String countryCode, RuntimeException error) {
        failures.put(operation + ":" + countryCode, error);
        return this;
    }

    public List<Call> calls() {
        return List.copyOf(calls);
    }

    public List<Call> calls(String operation) {
        return calls.stream().filter(c -> c.operation().equals(operation)).toList();
    }

    public void reset() {
        calls.clear();
    }

    @Override
    public CompletableFuture<LookupOutcome<List<IndexRow>>> nearby(GeographicCoordinates center, double radiusKm,
                                                                   String countryCode, int limit) {
        return answer(new Call(NEARBY, center.lat() + "," + center.lng() + "@" + radiusKm, countryCode, limit));
    }

    @Override
    public CompletableFuture<LookupOutcome<List<IndexRow>>> postalLookup(String postalCode, String countryCode,
                                                                         int limit) {
        return answer(new Call(POSTAL, postalCode, countryCode, limit));
    }

    @Override
    public CompletableFuture<LookupOutcome<List<IndexRow>>> cityLookup(String city, String countryCode, int limit) {
        return answer(new Call(CITY, city, countryCode, limit));
    }

    @Override
    public CompletableFuture<LookupOutcome<List<IndexRow>>> regionLookup(String region, String countryCode,
                                                                         int limit) {
        return answer(new Call(REGION, region, countryCode, limit));
    }

    private CompletableFuture<LookupOutcome<List<IndexRow>>> answer(Call call) {
        calls.add(call);
        RuntimeException failure = lookup(failures, call);
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        LookupOutcome<List<IndexRow>> outcome = lookup(responses, call);
        return CompletableFuture.completedFuture(outcome != null ? outcome : LookupOutcome.ok(List.of()));
    }

    private static <V> V lookup(Map<String, V> table, Call call) {
        V exact = table.get(call.operation() + ":" + call.countryCode());
        return exact != null ? exact : table.get(call.operation() + ":*");
    }

    public static IndexRow row(String id, String city, String postalCode, String region, String countryCode,
                               double lat, double lng) {
        return new IndexRow(id, city, city, postalCode, region, null, countryCode,
                new GeographicCoordinates(lat, lng), null);
    }
}
