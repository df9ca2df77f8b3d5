package com.flighttracker.tracker.application.controller;

import com.flighttracker.tracker.domain.exceptions.AmbiguousTrackerIdException;
import com.flighttracker.tracker.domain.exceptions.ProviderException;
import com.flighttracker.tracker.domain.exceptions.TrackerLimitExceededException;
import com.flighttracker.tracker.domain.exceptions.TrackerNotFoundException;
import com.flighttracker.tracker.domain.exceptions.TrackerNotOwnedException;
import com.flighttracker.tracker.domain.exceptions.TrackerValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(TrackerNotFoundException.class)
    public ProblemDetail handleTrackerNotFound(TrackerNotFoundException ex) {
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
        problem.setTitle("Tracker Not Found");
        problem.setProperty("code", ErrorCodes.TRACKER_NOT_FOUND);
        return problem;
    }

    @ExceptionHandler(TrackerNotOwnedException.class)
    public ProblemDetail handleTrackerNotOwned(TrackerNotOwnedException ex) {
        log.warn("Ownership violation: {}", ex.getMessage());
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.FORBIDDEN, "Tracker belongs to another owner");
        problem.setTitle("Forbidden");
        problem.setProperty("code", ErrorCodes.TRACKER_FORBIDDEN);
        return problem;
    }

    @ExceptionHandler(TrackerValidationException.class)
    public ProblemDetail handleTrackerValidation(TrackerValidationException ex) {
        return validationProblem(ex.errors());
    }

    @ExceptionHandler(AmbiguousTrackerIdException.class)
    public ProblemDetail handleAmbiguousId(AmbiguousTrackerIdException ex) {
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Ambiguous Tracker Id");
        problem.setProperty("code", ErrorCodes.AMBIGUOUS_TRACKER_ID);
        return problem;
    }

    @ExceptionHandler(TrackerLimitExceededException.class)
    public ProblemDetail handleLimitExceeded(TrackerLimitExceededException ex) {
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.TOO_MANY_REQUESTS, ex.getMessage());
        problem.setTitle("Tracker Limit Exceeded");
        problem.setProperty("code", ErrorCodes.TRACKER_LIMIT_EXCEEDED);
        return problem;
    }

    @ExceptionHandler(ProviderException.class)
    public ProblemDetail handleProvider(ProviderException ex) {
        log.warn("Flight search failed: {}", ex.getMessage());
        var status = ex.isTransient() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.BAD_GATEWAY;
        var problem = ProblemDetail.forStatusAndDetail(status, "Flight search provider failed");
        problem.setTitle("Provider Error");
        problem.setProperty("code", ErrorCodes.PROVIDER_ERROR);
        return problem;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        var errors = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .toList();
        return validationProblem(errors);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ProblemDetail handleMissingHeader(MissingRequestHeaderException ex) {
        return validationProblem(List.of(ex.getHeaderName() + ": required"));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ProblemDetail handleMissingParameter(MissingServletRequestParameterException ex) {
        return validationProblem(List.of(ex.getParameterName() + ": required"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ProblemDetail handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return validationProblem(List.of(ex.getName() + ": invalid value '" + ex.getValue() + "'"));
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
        problem.setTitle("Internal Server Error");
        problem.setProperty("code", ErrorCodes.INTERNAL_ERROR);
        return problem;
    }

    private static ProblemDetail validationProblem(List<String> errors) {
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Validation failed");
        problem.setTitle("Bad Request");
        problem.setProperty("code", ErrorCodes.VALIDATION_ERROR);
        problem.setProperty("errors", errors);
        return problem;
    }
}
