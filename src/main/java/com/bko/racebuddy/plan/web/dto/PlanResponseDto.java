package com.bko.racebuddy.plan.web.dto;

import com.bko.racebuddy.plan.domain.TrainingPlan;

import java.time.Instant;
import java.util.List;

public record PlanResponseDto(
        PlanSummaryDto summary,
        List<WeekDto> weeks,
        List<SessionDto> sessions,
        Instant generatedAt
) {
    public static PlanResponseDto from(TrainingPlan plan, Instant generatedAt) {
        return new PlanResponseDto(
                PlanSummaryDto.from(plan.summary()),
                plan.weeks().stream().map(WeekDto::from).toList(),
                plan.sessions().stream().map(SessionDto::from).toList(),
                generatedAt
        );
    }
}
