package com.bko.racebuddy.plan.web.dto;

import com.bko.racebuddy.plan.domain.PaceZone;
import com.bko.racebuddy.plan.domain.PlanSummary;

import java.time.Duration;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

public record PlanSummaryDto(
        String race,
        String raceName,
        double raceDistanceKm,
        int totalWeeks,
        double totalDistanceKm,
        LocalDate startDate,
        LocalDate raceDate,
        String gender,
        int age,
        String fitnessLevel,
        String targetTime,
        int trainingDaysPerWeek,
        Map<String, String> paces
) {
    public static PlanSummaryDto from(PlanSummary summary) {
        Map<String, String> paces = new LinkedHashMap<>();
        for (PaceZone zone : PaceZone.values()) {
            paces.put(zone.code(), summary.paces().format(zone));
        }
        return new PlanSummaryDto(
                summary.raceId(),
                summary.raceName(),
                summary.raceDistanceKm(),
                summary.totalWeeks(),
                summary.totalDistanceKm(),
                summary.startDate(),
                summary.raceDate(),
                summary.gender().code(),
                summary.age(),
                summary.fitnessLevel().code(),
                formatTime(summary.targetTime()),
                summary.trainingDaysPerWeek(),
                paces
        );
    }

    static String formatTime(Duration duration) {
        long seconds = duration.getSeconds();
        return String.format("%d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }
}
