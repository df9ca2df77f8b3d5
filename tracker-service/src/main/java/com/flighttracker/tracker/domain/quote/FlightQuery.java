package com.flighttracker.tracker.domain.quote;

import com.flighttracker.common.flight.SeatClass;
import com.flighttracker.tracker.domain.tracker.Tracker;
import lombok.Builder;

import java.time.LocalDate;

/**
 * One provider query. {@code returnDate} is null for a one-way trip; trackers always query one way.
 */
@Builder(toBuilder = true)
public record FlightQuery(
        String origin,
        String destination,
        LocalDate date,
        LocalDate returnDate,
        int adults,
        SeatClass seatClass,
        Integer maxStops
) {

    public static FlightQuery forTracker(Tracker tracker, LocalDate date) {
        return FlightQuery.builder()
                .origin(tracker.origin())
                .destination(tracker.destination())
                .date(date)
                .adults(tracker.adults())
                .seatClass(tracker.seatClass())
                .maxStops(tracker.maxStops())
                .build();
    }

    public boolean isRoundTrip() {
        return returnDate != null;
    }

    @Override
    public String toString() {
        var leg = origin + "->" + destination + " on " + date;
        return isRoundTrip() ? leg + " returning " + returnDate : leg;
    }
}
