package com.flighttracker.tracker.domain.exceptions;

public class TrackerLimitExceededException extends RuntimeException {

    private TrackerLimitExceededException(String message) {
        super(message);
    }

    public static TrackerLimitExceededException of(String ownerId, int max) {
        return new TrackerLimitExceededException("Tracker limit reached for " + ownerId + ": " + max + " active trackers");
    }
}
