package com.bko.racebuddy.plan.app;

import com.bko.racebuddy.plan.domain.FitnessLevel;
import com.bko.racebuddy.plan.domain.InvalidInputException;
import com.bko.racebuddy.plan.domain.PaceSet;
import com.bko.racebuddy.plan.domain.PaceZone;
import com.bko.racebuddy.race.Race;
import com.bko.racebuddy.race.RaceCatalog;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Derives training paces from a goal finish time. The race pace is the goal time divided by the
 * race distance; every other zone is the race pace scaled by the fitness level's multiplier, so
 * the same goal gives a beginner easier easy runs than an advanced runner.
 */
@Component
public class PaceModel {
    private final RaceCatalog raceCatalog;
    private final TrainingTables tables;

    public PaceModel(RaceCatalog raceCatalog, TrainingTables tables) {
        this.raceCatalog = raceCatalog;
        this.tables = tables;
    }

    public Race resolveRace(String raceId) {
        return raceCatalog.find(raceId).orElseThrow(() -> new InvalidInputException(
                "Unknown race '" + raceId + "'. Available races: " + knownRaceIds()));
    }

    public PaceSet derivePaces(String raceId, Duration targetTime, FitnessLevel level) {
        return derivePaces(resolveRace(raceId), targetTime, level);
    }

    public PaceSet derivePaces(Race race, Duration targetTime, FitnessLevel level) {
        if (targetTime == null || targetTime.isZero() || targetTime.isNegative()) {
            throw new InvalidInputException("Target time must be greater than zero.");
        }
        if (race == null || !(race.distanceKm() > 0)) {
            throw new InvalidInputException("Race distance is not known for the selected race.");
        }
        if (level == null) {
            throw new InvalidInputException("Fitness level is required.");
        }

        double racePaceMillis = targetTime.toMillis() / race.distanceKm();
        TrainingTables.LevelTable table = tables.level(level);

        Map<PaceZone, Duration> paces = new EnumMap<>(PaceZone.class);
        for (PaceZone zone : PaceZone.values()) {
            paces.put(zone, Duration.ofMillis(Math.round(racePaceMillis * table.paceMultiplier(zone))));
        }
        return new PaceSet(paces);
    }

    private String knownRaceIds() {
        return raceCatalog.list().stream()
                .map(Race::id)
                .collect(Collectors.joining(", "));
    }
}
