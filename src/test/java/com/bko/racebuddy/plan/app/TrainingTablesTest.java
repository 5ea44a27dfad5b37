package com.bko.racebuddy.plan.app;

import com.bko.racebuddy.plan.domain.FitnessLevel;
import com.bko.racebuddy.plan.domain.PaceZone;
import com.bko.racebuddy.plan.domain.Phase;
import com.bko.racebuddy.plan.domain.SessionType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TrainingTablesTest {

    @Test
    void loadsBundledTables() {
        TrainingTables tables = PlanFixtures.tables();

        assertEquals(35.0, tables.level(FitnessLevel.INTERMEDIATE).startVolumeKm());
        assertEquals(60.0, tables.level(FitnessLevel.INTERMEDIATE).peakVolumeKm());
        assertEquals(1.0, tables.level(FitnessLevel.ADVANCED).paceMultiplier(PaceZone.RACE));
        assertEquals(4, tables.recoveryInterval());
        assertEquals(
                List.of(SessionType.LONG_RUN, SessionType.TEMPO, SessionType.EASY_RUN, SessionType.EASY_RUN),
                tables.template(Phase.BUILD, 4));
    }

    @Test
    void startAndPeakVolumesGrowWithFitnessLevel() {
        TrainingTables tables = PlanFixtures.tables();

        assertTrue(tables.level(FitnessLevel.BEGINNER).startVolumeKm() < tables.level(FitnessLevel.INTERMEDIATE).startVolumeKm());
        assertTrue(tables.level(FitnessLevel.INTERMEDIATE).startVolumeKm() < tables.level(FitnessLevel.ADVANCED).startVolumeKm());
        assertTrue(tables.level(FitnessLevel.BEGINNER).peakVolumeKm() < tables.level(FitnessLevel.ADVANCED).peakVolumeKm());
    }

    @Test
    void crossTrainingCarriesNoDistanceWeight() {
        TrainingTables tables = PlanFixtures.tables();

        for (FitnessLevel level : FitnessLevel.values()) {
            assertEquals(0.0, tables.level(level).sessionWeight(SessionType.CROSS_TRAIN));
        }
    }

    @Test
    void missingResourceFails() {
        assertThrows(FileNotFoundException.class,
                () -> TrainingTables.load(new ObjectMapper(), "no-such-tables.json"));
    }

    @Test
    void rejectsTemplateWithoutLongRun() {
        TrainingTables.TablesDocument document = new TrainingTables.TablesDocument(
                new TrainingTables.PhaseSplit(0.4, 0.15, 0.1), 4, 0.75, 0.5, 45,
                Map.of("beginner", level(), "intermediate", level(), "advanced", level()),
                Map.of("base", templates(List.of("easy_run", "easy_run", "easy_run")),
                        "build", templates(List.of("long_run", "tempo", "easy_run")),
                        "peak", templates(List.of("long_run", "tempo", "easy_run")),
                        "taper", templates(List.of("long_run", "tempo", "easy_run"))));

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> TrainingTables.fromDocument(document));
        assertTrue(e.getMessage().contains("base/3"));
    }

    private static TrainingTables.LevelDocument level() {
        return new TrainingTables.LevelDocument(30.0, 50.0,
                Map.of("easy", 1.25, "tempo", 1.02, "threshold", 0.97, "interval", 0.9, "race", 1.0),
                Map.of("long_run", 0.33, "tempo", 0.17, "easy_run", 0.15));
    }

    private static Map<String, List<String>> templates(List<String> threeDays) {
        return Map.of(
                "3", threeDays,
                "4", List.of("long_run", "tempo", "easy_run", "easy_run"),
                "5", List.of("long_run", "tempo", "easy_run", "easy_run", "easy_run"),
                "6", List.of("long_run", "tempo", "easy_run", "easy_run", "easy_run", "easy_run"),
                "7", List.of("long_run", "tempo", "easy_run", "easy_run", "easy_run", "easy_run", "cross_train"));
    }
}
