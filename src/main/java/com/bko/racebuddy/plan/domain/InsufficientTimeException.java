package com.bko.racebuddy.plan.domain;

public class InsufficientTimeException extends PlanGenerationException {
    public static final String CODE = "INSUFFICIENT_TIME";

    private final int totalWeeks;

    public InsufficientTimeException(int totalWeeks, int minimumWeeks) {
        super("At least " + minimumWeeks + " weeks are needed before the race, got " + totalWeeks
                + ". Choose a later race date.", CODE);
        this.totalWeeks = totalWeeks;
    }

    public int getTotalWeeks() {
        return totalWeeks;
    }
}
