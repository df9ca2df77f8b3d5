package com.flighttracker.tracker.application.controller.tracker;

import com.flighttracker.common.flight.SeatClass;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * {@code endDate} is exclusive.
 */
public record TrackerResponse(
        String id,
        String shortId,
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
        boolean stale) {}
