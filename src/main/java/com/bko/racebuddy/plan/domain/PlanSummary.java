package com.bko.racebuddy.plan.domain;

import java.time.Duration;
import java.time.LocalDate;

public record PlanSummary(
        String raceId,
        String raceName,
        double raceDistanceKm,
        int totalWeeks,
        double totalDistanceKm,
        LocalDate startDate,
        LocalDate raceDate,
        Gender gender,
        int age,
        FitnessLevel fitnessLevel,
        Duration targetTime,
        int trainingDaysPerWeek,
        PaceSet paces
) {
}
