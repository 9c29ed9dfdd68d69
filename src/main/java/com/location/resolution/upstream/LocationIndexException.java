package com.location.resolution.upstream;

/**
 * Raised inside the HTTP clients when an upstream call fails. Never escapes a
 * client: it is converted to a {@link LookupOutcome} at the client boundary.
 */
public class LocationIndexException extends RuntimeException {

    private final LookupOutcome.Status status;

    public LocationIndexException(LookupOutcome.Status status, String message) {
        super(message);
        this.status = status;
    }

    public LocationIndexException(LookupOutcome.Status status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public LookupOutcome.Status getStatus() {
        return status;
    }
}
