package com.bko.racebuddy.plan.domain;

import java.time.Duration;
import java.time.LocalDate;

/**
 * One calendar day of the plan. Rest days carry zero distance and no pace.
 */
public record Session(
        int weekNumber,
        LocalDate date,
        String dayName,
        SessionType type,
        double distanceKm,
        Duration pace,
        String weekFocus,
        String title,
        String description,
        String intensity,
        int durationMinutes
) {
    public boolean isRest() {
        return type == SessionType.REST;
    }
}
