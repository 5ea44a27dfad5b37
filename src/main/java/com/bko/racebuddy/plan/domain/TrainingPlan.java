package com.bko.racebuddy.plan.domain;

import java.util.List;

/**
 * Generated plan. Sessions are ordered by week and date, one per day of every week.
 */
public record TrainingPlan(PlanSummary summary, List<WeekPlan> weeks, List<Session> sessions) {
    public TrainingPlan {
        weeks = List.copyOf(weeks);
        sessions = List.copyOf(sessions);
    }

    public List<Session> sessionsOfWeek(int weekNumber) {
        return sessions.stream()
                .filter(session -> session.weekNumber() == weekNumber)
                .toList();
    }
}
