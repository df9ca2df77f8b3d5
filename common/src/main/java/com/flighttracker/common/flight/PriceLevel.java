package com.flighttracker.common.flight;

import java.util.Locale;

/**
 * Coarse signal the provider attaches to a date's fares.
 */
public enum PriceLevel {
    LOW,
    TYPICAL,
    HIGH,
    UNKNOWN;

    public static PriceLevel fromProvider(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "low" -> LOW;
            case "typical" -> TYPICAL;
            case "high" -> HIGH;
            default -> UNKNOWN;
        };
    }
}
