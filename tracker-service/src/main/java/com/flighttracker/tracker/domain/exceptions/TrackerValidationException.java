package com.flighttracker.tracker.domain.exceptions;

import java.util.List;

public class TrackerValidationException extends RuntimeException {

    private final List<String> errors;

    private TrackerValidationException(List<String> errors) {
        super("Invalid tracker: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public static TrackerValidationException of(List<String> errors) {
        return new TrackerValidationException(errors);
    }

    public static TrackerValidationException of(String error) {
        return new TrackerValidationException(List.of(error));
    }

    public List<String> errors() {
        return errors;
    }
}
