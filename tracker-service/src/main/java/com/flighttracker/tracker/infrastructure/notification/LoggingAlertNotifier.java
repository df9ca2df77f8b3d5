package com.flighttracker.tracker.infrastructure.notification;

import com.flighttracker.tracker.domain.evaluation.PriceAlert;
import com.flighttracker.tracker.domain.notification.AlertNotifier;
import lombok.extern.slf4j.Slf4j;

/**
 * Fallback channel when no webhook is configured: the alert only goes to the log.
 */
@Slf4j
public class LoggingAlertNotifier implements AlertNotifier {

    @Override
    public void send(PriceAlert alert) {
        log.info("price.alert: tracker_id={}, owner_id={}, channel_id={}, route={}->{}, date={}, price={}, threshold={}, carrier={}",
                alert.trackerId(), alert.ownerId(), alert.channelId(), alert.origin(), alert.destination(),
                alert.date(), alert.price(), alert.thresholdPrice(), alert.carrier());
    }
}
