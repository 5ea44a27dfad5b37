package com.bko.racebuddy.plan.web.dto;

import com.bko.racebuddy.plan.domain.PaceSet;
import com.bko.racebuddy.plan.domain.Session;

import java.time.LocalDate;

/**
 * One calendar entry, shaped for the calendar view and the .ics export.
 */
public record SessionDto(
        int weekNumber,
        LocalDate date,
        String dayName,
        String type,
        String title,
        String description,
        double distanceKm,
        String pace,
        int durationMinutes,
        String intensity,
        String weekFocus
) {
    public static SessionDto from(Session session) {
        return new SessionDto(
                session.weekNumber(),
                session.date(),
                session.dayName(),
                session.type().code(),
                session.title(),
                session.description(),
                session.distanceKm(),
                PaceSet.formatPace(session.pace()),
                session.durationMinutes(),
                session.intensity(),
                session.weekFocus()
        );
    }
}
