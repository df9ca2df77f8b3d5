package com.flighttracker.tracker.domain.quote;

import lombok.Builder;

import java.time.Duration;

@Builder(toBuilder = true)
public record RetryPolicy(int maxAttempts, Duration initialDelay, double multiplier, Duration maxDelay) {

    /** Delay before retry number {@code attempt} (1-based), capped at {@code maxDelay}. */
    public Duration backoff(int attempt) {
        double millis = initialDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        return Duration.ofMillis((long) Math.min(millis, maxDelay.toMillis()));
    }
}
