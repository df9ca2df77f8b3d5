package com.flighttracker.tracker.application.controller.tracker;

import com.flighttracker.common.flight.SeatClass;
import com.flighttracker.tracker.domain.exceptions.TrackerValidationException;
import com.flighttracker.tracker.domain.tracker.CreateTrackerCommand;
import com.flighttracker.tracker.domain.tracker.DateRangeRequest;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * {@code startDate} is either an ISO date or {@value #THIS_MONTH}; when absent the current month is tracked.
 */
public record CreateTrackerRequest(
        @NotNull @Pattern(regexp = "^[A-Za-z]{3}$", message = "Origin must be a 3-letter airport code")
        String origin,

        @NotNull @Pattern(regexp = "^[A-Za-z]{3}$", message = "Destination must be a 3-letter airport code")
        String destination,

        String startDate,

        @Min(value = 1, message = "Days must be at least 1")
        Integer days,

        @NotNull @DecimalMin(value = "0.01", message = "Max price must be positive")
        @Digits(integer = 10, fraction = 2, message = "Max 10 integer + 2 decimal digits")
        BigDecimal maxPrice,

        @Min(value = 1, message = "At least one adult")
        Integer adults,

        String seatClass,

        @Min(0) @Max(2)
        Integer maxStops,

        String channelId
) {

    public static final String THIS_MONTH = "this_month";

    public CreateTrackerCommand toCommand(String ownerId) {
        return CreateTrackerCommand.builder()
                .ownerId(ownerId)
                .channelId(channelId)
                .origin(origin)
                .destination(destination)
                .dateRange(dateRange())
                .adults(adults)
                .seatClass(seat())
                .maxStops(maxStops)
                .thresholdPrice(maxPrice)
                .build();
    }

    private DateRangeRequest dateRange() {
        if (startDate == null || startDate.isBlank() || THIS_MONTH.equalsIgnoreCase(startDate.trim())) {
            return DateRangeRequest.thisMonth();
        }
        try {
            return DateRangeRequest.explicit(LocalDate.parse(startDate.trim()), days);
        } catch (DateTimeParseException e) {
            throw TrackerValidationException.of("startDate: use YYYY-MM-DD or " + THIS_MONTH);
        }
    }

    private SeatClass seat() {
        if (seatClass == null || seatClass.isBlank()) {
            return SeatClass.ECONOMY;
        }
        return SeatClass.fromWireName(seatClass)
                .orElseThrow(() -> TrackerValidationException.of(
                        "seatClass: must be one of economy, premium-economy, business, first"));
    }
}
