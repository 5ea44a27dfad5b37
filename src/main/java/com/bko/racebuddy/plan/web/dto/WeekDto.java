package com.bko.racebuddy.plan.web.dto;

import com.bko.racebuddy.plan.domain.WeekPlan;

import java.time.LocalDate;

public record WeekDto(
        int weekNumber,
        String phase,
        String focus,
        double targetDistanceKm,
        boolean recoveryWeek,
        LocalDate startDate,
        LocalDate endDate
) {
    public static WeekDto from(WeekPlan week) {
        return new WeekDto(week.weekNumber(), week.phase().code(), week.focus(), week.targetDistanceKm(),
                week.recoveryWeek(), week.startDate(), week.endDate());
    }
}
