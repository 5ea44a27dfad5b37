package com.bko.racebuddy.plan.domain;

public class InvalidScheduleConstraintException extends PlanGenerationException {
    public static final String CODE = "INVALID_SCHEDULE_CONSTRAINT";

    public InvalidScheduleConstraintException(int trainingDaysPerWeek, int min, int max) {
        super("Training days per week must be between " + min + " and " + max + ", got "
                + trainingDaysPerWeek + ".", CODE);
    }
}
