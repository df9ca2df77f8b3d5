package com.flighttracker.tracker.domain.tracker;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Concrete travel-date window, start inclusive and end exclusive.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Date range must be non-empty: " + start + " .. " + end);
        }
    }

    public static DateRange ofDays(LocalDate start, int days) {
        return new DateRange(start, start.plusDays(days));
    }

    public static DateRange monthOf(LocalDate day) {
        var first = day.withDayOfMonth(1);
        return new DateRange(first, first.plusMonths(1));
    }

    public long length() {
        return ChronoUnit.DAYS.between(start, end);
    }

    /** True when no travel date in the range is today or later. */
    public boolean isExhausted(LocalDate today) {
        return !end.isAfter(today);
    }
}
