package com.flighttracker.tracker.domain.tracker;

import java.time.LocalDate;

/**
 * Date-range descriptor as the user gave it: an explicit start plus a day count,
 * or the current calendar month. Resolved to a {@link DateRange} once, at creation.
 */
public record DateRangeRequest(LocalDate startDate, Integer days, boolean currentMonth) {

    public static final int DEFAULT_DAYS = 30;

    public static DateRangeRequest thisMonth() {
        return new DateRangeRequest(null, null, true);
    }

    public static DateRangeRequest explicit(LocalDate startDate, Integer days) {
        return new DateRangeRequest(startDate, days != null ? days : DEFAULT_DAYS, false);
    }
}
