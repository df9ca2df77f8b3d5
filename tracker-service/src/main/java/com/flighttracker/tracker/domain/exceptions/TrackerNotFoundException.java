package com.flighttracker.tracker.domain.exceptions;

public class TrackerNotFoundException extends RuntimeException {

    private TrackerNotFoundException(String message) {
        super(message);
    }

    public static TrackerNotFoundException of(String trackerId) {
        return new TrackerNotFoundException("Tracker not found: " + trackerId);
    }
}
