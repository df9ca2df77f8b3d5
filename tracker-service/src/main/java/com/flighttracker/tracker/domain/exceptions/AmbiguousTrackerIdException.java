package com.flighttracker.tracker.domain.exceptions;

public class AmbiguousTrackerIdException extends RuntimeException {

    private AmbiguousTrackerIdException(String message) {
        super(message);
    }

    public static AmbiguousTrackerIdException of(String prefix, int matches) {
        return new AmbiguousTrackerIdException(
                "Tracker id '" + prefix + "' matches " + matches + " trackers, use a longer id");
    }
}
