package com.flighttracker.tracker.domain.quote;

import com.flighttracker.common.flight.PriceLevel;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Cheapest qualifying fare found for one travel date in one cycle. {@code price} is null when
 * the provider answered for the date but offered no qualifying fare.
 */
@Builder(toBuilder = true)
public record QuoteSample(
        LocalDate date,
        BigDecimal price,
        Integer stops,
        PriceLevel priceLevel,
        String carrier
) {

    public static QuoteSample of(LocalDate date, Itinerary itinerary, PriceLevel priceLevel) {
        return QuoteSample.builder()
                .date(date)
                .price(itinerary.price())
                .stops(itinerary.stops())
                .priceLevel(priceLevel)
                .carrier(itinerary.carrier())
                .build();
    }

    public static QuoteSample unavailable(LocalDate date, PriceLevel priceLevel) {
        return QuoteSample.builder()
                .date(date)
                .priceLevel(priceLevel)
                .build();
    }
}
