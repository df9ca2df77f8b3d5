package com.flighttracker.tracker.domain.evaluation;

import com.flighttracker.common.flight.PriceLevel;
import com.flighttracker.tracker.domain.quote.QuoteSample;
import com.flighttracker.tracker.domain.tracker.Tracker;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static com.flighttracker.tracker.test.fixtures.TrackerFixtures.NOW;
import static com.flighttracker.tracker.test.fixtures.TrackerFixtures.TRAVEL_START;
import static com.flighttracker.tracker.test.fixtures.TrackerFixtures.rduToMiaTrackerBuilder;
import static com.flighttracker.tracker.test.fixtures.TrackerFixtures.sample;
import static com.flighttracker.tracker.test.fixtures.TrackerFixtures.somePollingPolicy;
import static org.assertj.core.api.Assertions.assertThat;

class PriceEvaluatorTest {

    private final PriceEvaluator evaluator = new PriceEvaluator(somePollingPolicy());

    @Test
    void shouldNotifyWhenCheapestFareIsAtOrBelowThreshold() {
        var tracker = rduToMiaTrackerBuilder().build();

        var evaluation = evaluator.evaluate(tracker, List.of(
                sample(TRAVEL_START, "420.00"),
                sample(TRAVEL_START.plusDays(2), "350.00"),
                sample(TRAVEL_START.plusDays(4), "390.00")), NOW);

        assertThat(evaluation.shouldNotify()).isTrue();
        assertThat(evaluation.alert().price()).isEqualByComparingTo("350.00");
        assertThat(evaluation.alert().date()).isEqualTo(TRAVEL_START.plusDays(2));
        assertThat(evaluation.alert().trackerId()).isEqualTo(tracker.id());
        assertThat(evaluation.alert().thresholdPrice()).isEqualByComparingTo("400.00");
        assertThat(evaluation.alert().detectedAt()).isEqualTo(NOW);
    }

    @Test
    void shouldNotifyWhenFareEqualsThreshold() {
        var evaluation = evaluator.evaluate(rduToMiaTrackerBuilder().build(),
                List.of(sample(TRAVEL_START, "400.00")), NOW);

        assertThat(evaluation.shouldNotify()).isTrue();
    }

    @Test
    void shouldPickEarliestDateOnPriceTie() {
        var evaluation = evaluator.evaluate(rduToMiaTrackerBuilder().build(), List.of(
                sample(TRAVEL_START.plusDays(3), "350.00"),
                sample(TRAVEL_START.plusDays(1), "350.00")), NOW);

        assertThat(evaluation.cheapest().date()).isEqualTo(TRAVEL_START.plusDays(1));
    }

    @Test
    void shouldNeverNotifyAboveThreshold() {
        var evaluation = evaluator.evaluate(rduToMiaTrackerBuilder().build(), List.of(
                sample(TRAVEL_START, "420.00"),
                sample(TRAVEL_START.plusDays(1), "400.01")), NOW);

        assertThat(evaluation.shouldNotify()).isFalse();
        assertThat(evaluation.rearm()).isFalse();
        assertThat(evaluation.cheapest().price()).isEqualByComparingTo("400.01");
    }

    @Test
    void shouldRearmWhenAnnouncedDateIsRecheckedAboveThreshold() {
        var tracker = notifiedAt350On(TRAVEL_START);

        var evaluation = evaluator.evaluate(tracker, List.of(
                sample(TRAVEL_START, "420.00"),
                sample(TRAVEL_START.plusDays(2), "450.00")), NOW);
        var updated = evaluation.applyTo(tracker, NOW, false);

        assertThat(evaluation.rearm()).isTrue();
        assertThat(updated.lastNotifiedPrice()).isNull();
        assertThat(updated.lastNotifiedPriceDate()).isNull();
        assertThat(updated.lastNotifiedAt()).isNull();
    }

    @Test
    void shouldRearmWhenAnnouncedDateNoLongerOffersAnyFare() {
        var tracker = notifiedAt350On(TRAVEL_START);

        var evaluation = evaluator.evaluate(tracker, List.of(
                QuoteSample.unavailable(TRAVEL_START, PriceLevel.UNKNOWN),
                sample(TRAVEL_START.plusDays(2), "450.00")), NOW);

        assertThat(evaluation.rearm()).isTrue();
    }

    @Test
    void shouldKeepNotificationWhenAnnouncedDateWasNotSampled() {
        var tracker = notifiedAt350On(TRAVEL_START);

        var evaluation = evaluator.evaluate(tracker, List.of(
                sample(TRAVEL_START.plusDays(1), "450.00"),
                sample(TRAVEL_START.plusDays(3), "450.00")), NOW);
        var updated = evaluation.applyTo(tracker, NOW, false);

        assertThat(evaluation.rearm()).isFalse();
        assertThat(updated.lastNotifiedPrice()).isEqualByComparingTo("350.00");
        assertThat(updated.lastNotifiedPriceDate()).isEqualTo(TRAVEL_START);
        assertThat(updated.lastPrice()).isEqualByComparingTo("450.00");
    }

    @Test
    void shouldSuppressSamePriceWithinCooldown() {
        var tracker = rduToMiaTrackerBuilder()
                .lastNotifiedPrice(new BigDecimal("350.00"))
                .lastNotifiedAt(NOW.minus(Duration.ofHours(6)))
                .build();

        var evaluation = evaluator.evaluate(tracker, List.of(sample(TRAVEL_START, "350.00")), NOW);

        assertThat(evaluation.shouldNotify()).isFalse();
        assertThat(evaluation.rearm()).isFalse();
    }

    @Test
    void shouldNotifyLowerPriceWithinCooldown() {
        var tracker = rduToMiaTrackerBuilder()
                .lastNotifiedPrice(new BigDecimal("350.00"))
                .lastNotifiedAt(NOW.minus(Duration.ofHours(6)))
                .build();

        var evaluation = evaluator.evaluate(tracker, List.of(sample(TRAVEL_START, "340.00")), NOW);

        assertThat(evaluation.shouldNotify()).isTrue();
        assertThat(evaluation.alert().price()).isEqualByComparingTo("340.00");
    }

    @Test
    void shouldNotifySamePriceAgainOnceCooldownElapsed() {
        var tracker = rduToMiaTrackerBuilder()
                .lastNotifiedPrice(new BigDecimal("350.00"))
                .lastNotifiedAt(NOW.minus(Duration.ofHours(24)))
                .build();

        var evaluation = evaluator.evaluate(tracker, List.of(sample(TRAVEL_START, "350.00")), NOW);

        assertThat(evaluation.shouldNotify()).isTrue();
    }

    @Test
    void shouldIgnoreFaresExceedingMaxStopsOrWithUnknownStops() {
        var tracker = rduToMiaTrackerBuilder().maxStops(0).build();

        var evaluation = evaluator.evaluate(tracker, List.of(
                sample(TRAVEL_START, "200.00", 1),
                sample(TRAVEL_START.plusDays(1), "250.00", null),
                sample(TRAVEL_START.plusDays(2), "380.00", 0)), NOW);

        assertThat(evaluation.cheapest().price()).isEqualByComparingTo("380.00");
        assertThat(evaluation.alert().stops()).isZero();
    }

    @Test
    void shouldKeepNotificationStateWhenNoQuotes() {
        var tracker = rduToMiaTrackerBuilder()
                .lastNotifiedPrice(new BigDecimal("350.00"))
                .lastNotifiedAt(NOW.minus(Duration.ofHours(6)))
                .build();

        var evaluation = evaluator.evaluate(tracker, List.of(), NOW);
        var updated = evaluation.applyTo(tracker, NOW, false);

        assertThat(evaluation.cheapest()).isNull();
        assertThat(updated.lastNotifiedPrice()).isEqualByComparingTo("350.00");
        assertThat(updated.lastCheckedAt()).isEqualTo(NOW);
        assertThat(updated.pollCycles()).isEqualTo(1);
    }

    @Test
    void shouldRecordNotificationOnlyWhenDelivered() {
        var tracker = rduToMiaTrackerBuilder().build();
        var evaluation = evaluator.evaluate(tracker, List.of(sample(TRAVEL_START, "350.00")), NOW);

        var undelivered = evaluation.applyTo(tracker, NOW, false);
        var delivered = evaluation.applyTo(tracker, NOW, true);

        assertThat(undelivered.lastPrice()).isEqualByComparingTo("350.00");
        assertThat(undelivered.lastNotifiedPrice()).isNull();
        assertThat(delivered.lastNotifiedPrice()).isEqualByComparingTo("350.00");
        assertThat(delivered.lastNotifiedAt()).isEqualTo(NOW);
        assertThat(delivered.lastNotifiedPriceDate()).isEqualTo(TRAVEL_START);
    }

    @Test
    void shouldTrackLowestPriceEverSeen() {
        var tracker = rduToMiaTrackerBuilder()
                .lowestPrice(new BigDecimal("300.00"))
                .lowestPriceDate(TRAVEL_START)
                .build();
        var evaluation = evaluator.evaluate(tracker, List.of(sample(TRAVEL_START.plusDays(1), "420.00")), NOW);

        var updated = evaluation.applyTo(tracker, NOW, false);

        assertThat(updated.lastPrice()).isEqualByComparingTo("420.00");
        assertThat(updated.lowestPrice()).isEqualByComparingTo("300.00");
        assertThat(updated.lowestPriceDate()).isEqualTo(TRAVEL_START);
    }

    private static Tracker notifiedAt350On(LocalDate date) {
        return rduToMiaTrackerBuilder()
                .lastNotifiedPrice(new BigDecimal("350.00"))
                .lastNotifiedPriceDate(date)
                .lastNotifiedAt(NOW.minus(Duration.ofHours(6)))
                .build();
    }
}
