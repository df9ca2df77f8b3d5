package com.flighttracker.tracker.infrastructure.provider;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Wire shape of the provider's search response.
 */
public record ProviderSearchResponse(
        @JsonProperty("current_price") String currentPrice,
        List<ProviderFlight> flights) {

    public record ProviderFlight(
            String name,
            String price,
            String stops,
            String duration,
            String departure,
            String arrival) {

        /** Stop count, or null when the provider reports it as unknown. */
        Integer stopCount() {
            if (stops == null || stops.isBlank()) {
                return null;
            }
            try {
                return Integer.valueOf(stops.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
    }
}
