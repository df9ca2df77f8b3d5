package com.flighttracker.tracker.application.controller;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ErrorCodes {

    public static final String TRACKER_NOT_FOUND = "TRACKER_NOT_FOUND";
    public static final String TRACKER_FORBIDDEN = "TRACKER_FORBIDDEN";
    public static final String AMBIGUOUS_TRACKER_ID = "AMBIGUOUS_TRACKER_ID";
    public static final String TRACKER_LIMIT_EXCEEDED = "TRACKER_LIMIT_EXCEEDED";
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String PROVIDER_ERROR = "PROVIDER_ERROR";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
}
