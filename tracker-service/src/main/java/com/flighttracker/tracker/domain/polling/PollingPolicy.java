package com.flighttracker.tracker.domain.polling;

import lombok.Builder;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Polling knobs shared by the poller and the evaluator.
 *
 * @param interval        minimum time between two checks of the same tracker
 * @param samplingBudget  max travel dates queried per tracker per cycle
 * @param cooldown        min time before re-alerting at an unchanged qualifying price
 * @param requestSpacing  pause between consecutive provider queries of one tracker
 * @param zone            zone in which "today" is evaluated
 */
@Builder(toBuilder = true)
public record PollingPolicy(
        Duration interval,
        int samplingBudget,
        Duration cooldown,
        Duration requestSpacing,
        ZoneId zone
) {
}
