package com.flighttracker.common.flight;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum SeatClass {
    ECONOMY("economy"),
    PREMIUM_ECONOMY("premium-economy"),
    BUSINESS("business"),
    FIRST("first");

    private final String wireName;

    SeatClass(String wireName) {
        this.wireName = wireName;
    }

    /** Name used by the flight-search provider and the command layer. */
    public String wireName() {
        return wireName;
    }

    public static Optional<SeatClass> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        var normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values())
                .filter(seat -> seat.wireName.equals(normalized))
                .findFirst();
    }
}
