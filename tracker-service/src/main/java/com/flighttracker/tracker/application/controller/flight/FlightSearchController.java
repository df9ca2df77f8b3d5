package com.flighttracker.tracker.application.controller.flight;

import com.flighttracker.common.flight.SeatClass;
import com.flighttracker.tracker.application.controller.flight.mapper.FlightSearchResponseMapper;
import com.flighttracker.tracker.domain.exceptions.TrackerValidationException;
import com.flighttracker.tracker.domain.quote.FlightQuery;
import com.flighttracker.tracker.domain.quote.FlightSearchService;
import java.time.LocalDate;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/flights")
@RequiredArgsConstructor
public class FlightSearchController {

    private final FlightSearchService flightSearchService;
    private final FlightSearchResponseMapper mapper;

    @GetMapping
    public FlightSearchResponse search(
            @RequestParam String origin,
            @RequestParam String destination,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate returnDate,
            @RequestParam(defaultValue = "1") int adults,
            @RequestParam(defaultValue = "economy") String seatClass,
            @RequestParam(required = false) Integer maxStops) {
        var seat = SeatClass.fromWireName(seatClass)
                .orElseThrow(() -> TrackerValidationException.of(
                        "seatClass: must be one of economy, premium-economy, business, first"));
        var query = FlightQuery.builder()
                .origin(origin)
                .destination(destination)
                .date(date)
                .returnDate(returnDate)
                .adults(adults)
                .seatClass(seat)
                .maxStops(maxStops)
                .build();
        var result = flightSearchService.search(query);
        return mapper.toResponse(query.toBuilder()
                .origin(query.origin().trim().toUpperCase(Locale.ROOT))
                .destination(query.destination().trim().toUpperCase(Locale.ROOT))
                .build(), result);
    }
}
