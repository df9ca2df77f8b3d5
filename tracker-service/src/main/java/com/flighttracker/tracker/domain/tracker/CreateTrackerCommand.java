package com.flighttracker.tracker.domain.tracker;

import com.flighttracker.common.flight.SeatClass;
import lombok.Builder;

import java.math.BigDecimal;

@Builder(toBuilder = true)
public record CreateTrackerCommand(
        String ownerId,
        String channelId,
        String origin,
        String destination,
        DateRangeRequest dateRange,
        Integer adults,
        SeatClass seatClass,
        Integer maxStops,
        BigDecimal thresholdPrice
) {
}
