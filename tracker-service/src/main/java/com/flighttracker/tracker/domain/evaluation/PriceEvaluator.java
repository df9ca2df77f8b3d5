package com.flighttracker.tracker.domain.evaluation;

import com.flighttracker.tracker.domain.polling.PollingPolicy;
import com.flighttracker.tracker.domain.quote.QuoteSample;
import com.flighttracker.tracker.domain.tracker.Tracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;

/**
 * Turns a cycle's samples into a notify / no-notify decision.
 *
 * <p>A qualifying fare (at or below the threshold) is announced when nothing was announced
 * yet, when it undercuts the last announced price, or when the cooldown since the last
 * announcement has elapsed. The notification record is cleared only when every fare is above
 * the threshold and the announced travel date was among the dates answered this cycle. A cycle
 * whose sample rotated away from that date leaves the record to the cooldown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PriceEvaluator {

    private static final Comparator<QuoteSample> CHEAPEST_FIRST =
            Comparator.comparing(QuoteSample::price).thenComparing(QuoteSample::date);

    private final PollingPolicy policy;

    public Evaluation evaluate(Tracker tracker, Collection<QuoteSample> samples, Instant now) {
        var cheapest = samples.stream()
                .filter(sample -> sample.price() != null)
                .filter(sample -> withinStops(sample, tracker.maxStops()))
                .min(CHEAPEST_FIRST)
                .orElse(null);

        if (cheapest == null) {
            return Evaluation.noQuotes();
        }

        if (cheapest.price().compareTo(tracker.thresholdPrice()) > 0) {
            return Evaluation.builder().cheapest(cheapest).rearm(announcedFareGone(tracker, samples)).build();
        }

        if (!isNewEvent(tracker, cheapest, now)) {
            log.debug("Tracker {} already notified at {} (now {}), suppressing",
                    tracker.id(), tracker.lastNotifiedPrice(), cheapest.price());
            return Evaluation.builder().cheapest(cheapest).build();
        }

        return Evaluation.builder()
                .cheapest(cheapest)
                .alert(toAlert(tracker, cheapest, now))
                .build();
    }

    private boolean isNewEvent(Tracker tracker, QuoteSample cheapest, Instant now) {
        if (!tracker.hasNotification()) {
            return true;
        }
        if (cheapest.price().compareTo(tracker.lastNotifiedPrice()) < 0) {
            return true;
        }
        return !now.isBefore(tracker.lastNotifiedAt().plus(policy.cooldown()));
    }

    private static boolean announcedFareGone(Tracker tracker, Collection<QuoteSample> samples) {
        if (!tracker.hasNotification()) {
            return false;
        }
        var announcedDate = tracker.lastNotifiedPriceDate();
        // Records written without a date cannot be matched against the sample.
        return announcedDate == null
                || samples.stream().anyMatch(sample -> announcedDate.equals(sample.date()));
    }

    private static boolean withinStops(QuoteSample sample, Integer maxStops) {
        return maxStops == null || (sample.stops() != null && sample.stops() <= maxStops);
    }

    private static PriceAlert toAlert(Tracker tracker, QuoteSample cheapest, Instant now) {
        return PriceAlert.builder()
                .trackerId(tracker.id())
                .ownerId(tracker.ownerId())
                .channelId(tracker.channelId())
                .origin(tracker.origin())
                .destination(tracker.destination())
                .date(cheapest.date())
                .price(cheapest.price())
                .thresholdPrice(tracker.thresholdPrice())
                .stops(cheapest.stops())
                .carrier(cheapest.carrier())
                .priceLevel(cheapest.priceLevel())
                .detectedAt(now)
                .build();
    }
}
