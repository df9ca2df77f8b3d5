package com.flighttracker.tracker.domain.quote;

import lombok.Builder;

import java.math.BigDecimal;

/**
 * One priced itinerary returned by the provider. {@code stops} is null when the provider
 * could not tell.
 */
@Builder(toBuilder = true)
public record Itinerary(
        BigDecimal price,
        Integer stops,
        String carrier,
        String duration,
        String departure,
        String arrival
) {

    public boolean withinStops(Integer maxStops) {
        return maxStops == null || (stops != null && stops <= maxStops);
    }
}
