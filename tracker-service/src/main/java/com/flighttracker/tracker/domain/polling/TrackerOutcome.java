package com.flighttracker.tracker.domain.polling;

/**
 * Result of processing one tracker in a cycle.
 */
public record TrackerOutcome(Status status, int failedQueries, boolean alertSent, boolean alertFailed) {

    public enum Status {
        CHECKED,
        STALE,
        REMOVED,
        INTERRUPTED,
        PERSISTENCE_FAILED,
        FAILED
    }

    public static TrackerOutcome checked(int failedQueries, boolean alertSent, boolean alertFailed) {
        return new TrackerOutcome(Status.CHECKED, failedQueries, alertSent, alertFailed);
    }

    public static TrackerOutcome of(Status status) {
        return new TrackerOutcome(status, 0, false, false);
    }

    public static TrackerOutcome of(Status status, int failedQueries) {
        return new TrackerOutcome(status, failedQueries, false, false);
    }
}
