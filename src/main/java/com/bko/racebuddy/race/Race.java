package com.bko.racebuddy.race;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * A race the planner can target. Tips and statistics are served from their own endpoints and may
 * be {@code null} for races that have none.
 */
public record Race(
        String id,
        String name,
        double distanceKm,
        String location,
        String description,
        int elevationGainM,
        String typicalConditions,
        List<String> keyChallenges,
        @JsonIgnore RaceTips tips,
        @JsonIgnore RaceStatistics statistics
) {
    public Race {
        keyChallenges = keyChallenges == null ? List.of() : List.copyOf(keyChallenges);
    }

    public Race(String id, String name, double distanceKm, String location, String description,
                int elevationGainM, String typicalConditions, List<String> keyChallenges) {
        this(id, name, distanceKm, location, description, elevationGainM, typicalConditions, keyChallenges,
                null, null);
    }
}
