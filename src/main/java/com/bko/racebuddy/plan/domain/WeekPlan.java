package com.bko.racebuddy.plan.domain;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public record WeekPlan(
        int weekNumber,
        Phase phase,
        double targetDistanceKm,
        boolean recoveryWeek,
        LocalDate startDate,
        LocalDate endDate
) {
    public static final int DAYS_PER_WEEK = 7;

    public static WeekPlan of(int weekNumber, Phase phase, double targetDistanceKm, boolean recoveryWeek,
                              LocalDate planStart) {
        LocalDate start = planStart.plusWeeks(weekNumber - 1L);
        return new WeekPlan(weekNumber, phase, targetDistanceKm, recoveryWeek, start,
                start.plusDays(DAYS_PER_WEEK - 1L));
    }

    public String focus() {
        return phase.focus();
    }

    public List<LocalDate> dates() {
        List<LocalDate> dates = new ArrayList<>(DAYS_PER_WEEK);
        for (int i = 0; i < DAYS_PER_WEEK; i++) {
            dates.add(startDate.plusDays(i));
        }
        return dates;
    }
}
