package com.bko.racebuddy.plan.domain;

/**
 * Malformed goal time, unknown race or any other field the planner cannot work with.
 */
public class InvalidInputException extends PlanGenerationException {
    public static final String CODE = "INVALID_INPUT";

    public InvalidInputException(String message) {
        super(message, CODE);
    }
}
