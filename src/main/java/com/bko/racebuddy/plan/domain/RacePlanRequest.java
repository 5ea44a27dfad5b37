package com.bko.racebuddy.plan.domain;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Objects;

public record RacePlanRequest(
        Profile profile,
        String raceId,
        Duration targetTime,
        LocalDate startDate,
        LocalDate raceDate
) {
    public RacePlanRequest {
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(startDate, "startDate");
        Objects.requireNonNull(raceDate, "raceDate");
    }
}
