package com.flighttracker.tracker.infrastructure.provider;

import java.math.BigDecimal;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Parses provider price strings such as {@code "$1,234"} or {@code "349.99"}.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class PriceParser {

    public static Optional<BigDecimal> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        var digits = raw.replace(",", "").replaceAll("[^\\d.]", "");
        if (digits.isEmpty()) {
            return Optional.empty();
        }
        try {
            var price = new BigDecimal(digits);
            return price.signum() > 0 ? Optional.of(price) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
