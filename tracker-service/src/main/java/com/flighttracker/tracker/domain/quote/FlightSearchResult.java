package com.flighttracker.tracker.domain.quote;

import com.flighttracker.common.flight.PriceLevel;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public record FlightSearchResult(List<Itinerary> itineraries, PriceLevel priceLevel) {

    public FlightSearchResult {
        itineraries = itineraries == null ? List.of() : List.copyOf(itineraries);
        priceLevel = priceLevel == null ? PriceLevel.UNKNOWN : priceLevel;
    }

    public static FlightSearchResult empty() {
        return new FlightSearchResult(List.of(), PriceLevel.UNKNOWN);
    }

    public Optional<Itinerary> cheapest(Integer maxStops) {
        return itineraries.stream()
                .filter(itinerary -> itinerary.withinStops(maxStops))
                .min(Comparator.comparing(Itinerary::price));
    }

    public List<Itinerary> sortedByPrice(Integer maxStops) {
        return itineraries.stream()
                .filter(itinerary -> itinerary.withinStops(maxStops))
                .sorted(Comparator.comparing(Itinerary::price))
                .toList();
    }
}
