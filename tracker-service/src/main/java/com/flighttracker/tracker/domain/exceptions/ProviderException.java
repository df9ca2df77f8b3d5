package com.flighttracker.tracker.domain.exceptions;

/**
 * Flight-search provider failure. Transient failures (I/O, timeouts, 5xx, 429) are retried.
 */
public class ProviderException extends RuntimeException {

    private final boolean transientFailure;

    private ProviderException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public static ProviderException transientFailure(String message, Throwable cause) {
        return new ProviderException(message, true, cause);
    }

    public static ProviderException permanentFailure(String message, Throwable cause) {
        return new ProviderException(message, false, cause);
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
