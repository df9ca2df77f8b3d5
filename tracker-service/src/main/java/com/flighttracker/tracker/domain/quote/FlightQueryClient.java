package com.flighttracker.tracker.domain.quote;

import com.flighttracker.tracker.domain.exceptions.ProviderException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Provider calls with retry and exponential backoff for transient failures.
 * Stateless, safe to share across poll workers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FlightQueryClient {

    private final FlightQuoteProvider provider;
    private final RetryPolicy retryPolicy;

    public FlightSearchResult search(FlightQuery query) {
        int attempt = 1;
        while (true) {
            try {
                return provider.search(query);
            } catch (ProviderException e) {
                if (!e.isTransient() || attempt >= retryPolicy.maxAttempts()) {
                    throw e;
                }
                var delay = retryPolicy.backoff(attempt);
                log.warn("Provider query {} failed (attempt {}/{}): {}. Retrying in {}ms",
                        query, attempt, retryPolicy.maxAttempts(), e.getMessage(), delay.toMillis());
                pause(delay.toMillis(), e);
                attempt++;
            }
        }
    }

    private static void pause(long millis, ProviderException lastFailure) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw lastFailure;
        }
    }
}
