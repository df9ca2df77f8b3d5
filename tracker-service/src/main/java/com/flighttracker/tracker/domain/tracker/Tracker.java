package com.flighttracker.tracker.domain.tracker;

import com.flighttracker.common.flight.SeatClass;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * A user's standing watch on a one-way route. {@code endDate} is exclusive.
 */
@Builder(toBuilder = true)
public record Tracker(
        String id,
        String ownerId,
        String channelId,
        String origin,
        String destination,
        LocalDate startDate,
        LocalDate endDate,
        int adults,
        SeatClass seatClass,
        Integer maxStops,
        BigDecimal thresholdPrice,
        Instant createdAt,
        Instant lastCheckedAt,
        BigDecimal lastPrice,
        LocalDate lastPriceDate,
        BigDecimal lowestPrice,
        LocalDate lowestPriceDate,
        BigDecimal lastNotifiedPrice,
        LocalDate lastNotifiedPriceDate,
        Instant lastNotifiedAt,
        long pollCycles,
        boolean stale
) {

    public DateRange dateRange() {
        return new DateRange(startDate, endDate);
    }

    public boolean isStale(LocalDate today) {
        return stale || dateRange().isExhausted(today);
    }

    public boolean hasNotification() {
        return lastNotifiedPrice != null && lastNotifiedAt != null;
    }
}
