package com.flighttracker.tracker.domain.quote;

import com.flighttracker.tracker.domain.exceptions.TrackerValidationException;
import com.flighttracker.tracker.domain.tracker.TrackerLimits;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * One-off search for the command layer, outside any tracker.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlightSearchService {

    private static final Pattern AIRPORT_CODE = Pattern.compile("^[A-Z]{3}$");

    private final FlightQueryClient queryClient;
    private final TrackerLimits limits;

    public FlightSearchResult search(FlightQuery query) {
        var normalized = normalize(query);
        var result = queryClient.search(normalized);
        log.info("Search {} returned {} itineraries", normalized, result.itineraries().size());
        return new FlightSearchResult(result.sortedByPrice(normalized.maxStops()), result.priceLevel());
    }

    private FlightQuery normalize(FlightQuery query) {
        var origin = query.origin() == null ? null : query.origin().trim().toUpperCase(Locale.ROOT);
        var destination = query.destination() == null ? null : query.destination().trim().toUpperCase(Locale.ROOT);
        var errors = new ArrayList<String>();
        if (origin == null || !AIRPORT_CODE.matcher(origin).matches()) {
            errors.add("origin: must be a 3-letter airport code");
        }
        if (destination == null || !AIRPORT_CODE.matcher(destination).matches()) {
            errors.add("destination: must be a 3-letter airport code");
        }
        if (origin != null && origin.equals(destination)) {
            errors.add("destination: must differ from origin");
        }
        if (query.date() == null) {
            errors.add("date: required");
        }
        if (query.date() != null && query.returnDate() != null && query.returnDate().isBefore(query.date())) {
            errors.add("returnDate: must not be before date");
        }
        if (query.adults() < 1 || query.adults() > limits.maxAdults()) {
            errors.add("adults: must be between 1 and " + limits.maxAdults());
        }
        if (query.seatClass() == null) {
            errors.add("seatClass: must be one of economy, premium-economy, business, first");
        }
        if (query.maxStops() != null && (query.maxStops() < 0 || query.maxStops() > 2)) {
            errors.add("maxStops: must be 0, 1 or 2");
        }
        if (!errors.isEmpty()) {
            throw TrackerValidationException.of(errors);
        }
        return query.toBuilder().origin(origin).destination(destination).build();
    }
}
