package com.bko.racebuddy.plan.app;

import com.bko.racebuddy.plan.domain.FitnessLevel;
import com.bko.racebuddy.plan.domain.Gender;
import com.bko.racebuddy.plan.domain.Profile;
import com.bko.racebuddy.plan.domain.RacePlanRequest;
import com.bko.racebuddy.race.RaceCatalog;
import com.bko.racebuddy.shared.PlannerSettings;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

public final class PlanFixtures {

    private PlanFixtures() {
    }

    public static TrainingTables tables() {
        try {
            return TrainingTables.load(new ObjectMapper(), PlannerSettings.DEFAULT_TABLES_RESOURCE);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static PlanAssembler assembler() {
        return assembler(PlannerSettings.defaults());
    }

    public static PlanAssembler assembler(PlannerSettings settings) {
        TrainingTables tables = tables();
        return new PlanAssembler(
                new PaceModel(new RaceCatalog(), tables),
                new PeriodizationPlanner(tables),
                new SessionScheduler(tables, settings)
        );
    }

    public static Profile profile(FitnessLevel level, int trainingDays) {
        return new Profile(Gender.FEMALE, 168, 60, 34, level, trainingDays,
                List.of(Duration.ofMinutes(195)), Set.of("old ankle sprain"));
    }

    public static RacePlanRequest request(FitnessLevel level, int trainingDays, LocalDate start, LocalDate race) {
        return new RacePlanRequest(profile(level, trainingDays), RaceCatalog.LIDINGO, Duration.ofHours(3), start, race);
    }

    /**
     * Intermediate runner, 4 days a week, 3:00:00 for 30 km, 2024-01-01 to 2024-03-25.
     */
    public static RacePlanRequest exampleRequest() {
        return request(FitnessLevel.INTERMEDIATE, 4, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 3, 25));
    }
}
