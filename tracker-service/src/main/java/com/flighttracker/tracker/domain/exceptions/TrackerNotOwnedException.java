package com.flighttracker.tracker.domain.exceptions;

public class TrackerNotOwnedException extends RuntimeException {

    private TrackerNotOwnedException(String message) {
        super(message);
    }

    public static TrackerNotOwnedException of(String trackerId, String ownerId) {
        return new TrackerNotOwnedException("Tracker " + trackerId + " is not owned by " + ownerId);
    }
}
