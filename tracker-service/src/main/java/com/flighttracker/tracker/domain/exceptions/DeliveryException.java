package com.flighttracker.tracker.domain.exceptions;

public class DeliveryException extends RuntimeException {

    private DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }

    public static DeliveryException of(String trackerId, Throwable cause) {
        return new DeliveryException("Alert delivery failed for tracker " + trackerId, cause);
    }

    public static DeliveryException rejected(String trackerId, int status) {
        return new DeliveryException("Alert for tracker " + trackerId + " rejected with HTTP " + status, null);
    }
}
