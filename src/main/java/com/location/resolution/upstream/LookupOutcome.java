package com.location.resolution.upstream;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Tagged result of a call to an external collaborator. Keeps "nothing matched"
 * apart from "the upstream failed" for logging and metrics, even though the
 * public API collapses both to an empty result.
 *
 * @param status outcome classification
 * @param value  the value, present only when {@code status == OK}
 * @param reason human-readable explanation for non-OK outcomes
 */
public record LookupOutcome<T>(Status status, T value, String reason) {

    public enum Status {
        OK,
        NOT_FOUND,
        UPSTREAM_UNAVAILABLE,
        MALFORMED
    }

    public LookupOutcome {
        Objects.requireNonNull(status, "status is required");
        if (status == Status.OK && value == null) {
            throw new IllegalArgumentException("OK outcome requires a value");
        }
        if (status != Status.OK && value != null) {
            throw new IllegalArgumentException("Only OK outcomes carry a value");
        }
    }

    public static <T> LookupOutcome<T> ok(T value) {
        return new LookupOutcome<>(Status.OK, value, null);
    }

    public static <T> LookupOutcome<T> notFound(String reason) {
        return new LookupOutcome<>(Status.NOT_FOUND, null, reason);
    }

    public static <T> LookupOutcome<T> unavailable(String reason) {
        return new LookupOutcome<>(Status.UPSTREAM_UNAVAILABLE, null, reason);
    }

    public static <T> LookupOutcome<T> malformed(String reason) {
        return new LookupOutcome<>(Status.MALFORMED, null, reason);
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    /**
     * True for failures of the upstream itself, as opposed to an empty match.
     */
    public boolean isFailure() {
        return status == Status.UPSTREAM_UNAVAILABLE || status == Status.MALFORMED;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    public T orElse(T fallback) {
        return isOk() ? value : fallback;
    }

    /**
     * Maps the value of an OK outcome; other outcomes keep their status and reason.
     */
    public <R> LookupOutcome<R> map(Function<? super T, ? extends R> mapper) {
        if (!isOk()) {
            return new LookupOutcome<>(status, null, reason);
        }
        return ok(mapper.apply(value));
    }
}
