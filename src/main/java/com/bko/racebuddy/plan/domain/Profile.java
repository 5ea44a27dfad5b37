package com.bko.racebuddy.plan.domain;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Runner profile as submitted. Field ranges are checked at request intake;
 * training days per week is checked again by the scheduler.
 */
public record Profile(
        Gender gender,
        double heightCm,
        double weightKg,
        int age,
        FitnessLevel fitnessLevel,
        int trainingDaysPerWeek,
        List<Duration> priorRaceTimes,
        Set<String> injuryNotes
) {
    public Profile {
        priorRaceTimes = priorRaceTimes == null ? List.of() : List.copyOf(priorRaceTimes);
        injuryNotes = injuryNotes == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(injuryNotes));
    }
}
