package com.flighttracker.tracker.domain.notification;

import com.flighttracker.tracker.domain.evaluation.PriceAlert;

/** Port to the notification channel. */
public interface AlertNotifier {

    /**
     * Returns normally once the alert is delivered.
     *
     * @throws com.flighttracker.tracker.domain.exceptions.DeliveryException when delivery fails
     */
    void send(PriceAlert alert);
}
