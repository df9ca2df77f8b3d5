package com.flighttracker.tracker.application.controller.flight.mapper;

import com.flighttracker.tracker.application.controller.flight.FlightSearchResponse;
import com.flighttracker.tracker.domain.quote.FlightQuery;
import com.flighttracker.tracker.domain.quote.FlightSearchResult;
import com.flighttracker.tracker.domain.quote.Itinerary;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface FlightSearchResponseMapper {

    @Mapping(target = "origin", source = "query.origin")
    @Mapping(target = "destination", source = "query.destination")
    @Mapping(target = "date", source = "query.date")
    @Mapping(target = "returnDate", source = "query.returnDate")
    @Mapping(target = "priceLevel", source = "result.priceLevel")
    @Mapping(target = "itineraries", source = "result.itineraries")
    FlightSearchResponse toResponse(FlightQuery query, FlightSearchResult result);

    FlightSearchResponse.ItineraryResponse toResponse(Itinerary itinerary);
}
