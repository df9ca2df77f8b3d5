package com.flighttracker.tracker.application.controller.flight;

import com.flighttracker.common.flight.PriceLevel;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record FlightSearchResponse(
        String origin,
        String destination,
        LocalDate date,
        LocalDate returnDate,
        PriceLevel priceLevel,
        List<ItineraryResponse> itineraries) {

    public record ItineraryResponse(
            BigDecimal price,
            Integer stops,
            String carrier,
            String duration,
            String departure,
            String arrival) {}
}
