package com.bko.racebuddy.plan.domain;

/**
 * Base class for failures of a single plan generation call.
 * All of them stem from the request itself, so none is retriable.
 */
public abstract class PlanGenerationException extends RuntimeException {
    private final String errorCode;

    protected PlanGenerationException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
