package com.flighttracker.tracker.domain.evaluation;

import com.flighttracker.tracker.domain.quote.QuoteSample;
import com.flighttracker.tracker.domain.tracker.Tracker;
import lombok.Builder;

import java.time.Instant;

/**
 * Outcome of one tracker's cycle.
 *
 * @param cheapest cheapest qualifying sample, null when no date produced a fare
 * @param alert    alert to deliver, null when nothing new qualifies
 * @param rearm    the announced fare was re-checked and no longer qualifies, so the next
 *                 qualifying fare is a new event
 */
@Builder(toBuilder = true)
public record Evaluation(QuoteSample cheapest, PriceAlert alert, boolean rearm) {

    public static Evaluation noQuotes() {
        return Evaluation.builder().build();
    }

    public boolean shouldNotify() {
        return alert != null;
    }

    /**
     * Applies this outcome to the current stored record. Price observations are always
     * kept; the notification record only when the alert was delivered.
     */
    public Tracker applyTo(Tracker current, Instant checkedAt, boolean delivered) {
        var updated = current.toBuilder()
                .lastCheckedAt(checkedAt)
                .pollCycles(current.pollCycles() + 1);

        if (cheapest != null) {
            updated.lastPrice(cheapest.price()).lastPriceDate(cheapest.date());
            if (current.lowestPrice() == null || cheapest.price().compareTo(current.lowestPrice()) < 0) {
                updated.lowestPrice(cheapest.price()).lowestPriceDate(cheapest.date());
            }
        }
        if (rearm) {
            updated.lastNotifiedPrice(null).lastNotifiedPriceDate(null).lastNotifiedAt(null);
        }
        if (alert != null && delivered) {
            updated.lastNotifiedPrice(alert.price()).lastNotifiedPriceDate(alert.date()).lastNotifiedAt(checkedAt);
        }
        return updated.build();
    }
}
