package com.bko.racebuddy.plan.app;

import com.bko.racebuddy.plan.domain.FitnessLevel;
import com.bko.racebuddy.plan.domain.InvalidInputException;
import com.bko.racebuddy.plan.domain.PaceSet;
import com.bko.racebuddy.plan.domain.PaceZone;
import com.bko.racebuddy.race.Race;
import com.bko.racebuddy.race.RaceCatalog;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PaceModelTest {
    private final PaceModel paceModel = new PaceModel(new RaceCatalog(), PlanFixtures.tables());

    @Test
    void racePaceIsGoalTimeOverDistance() {
        PaceSet paces = paceModel.derivePaces(RaceCatalog.LIDINGO, Duration.ofHours(3), FitnessLevel.INTERMEDIATE);

        assertEquals(Duration.ofMinutes(6), paces.pace(PaceZone.RACE));
        assertEquals(Duration.ofSeconds(450), paces.pace(PaceZone.EASY));
        assertEquals(Duration.ofSeconds(324), paces.pace(PaceZone.INTERVAL));
        assertEquals("6:00/km", paces.format(PaceZone.RACE));
        assertEquals("7:30/km", paces.format(PaceZone.EASY));
    }

    @Test
    void zonesGetFasterFromEasyToIntervalForEveryLevel() {
        for (Duration goal : List.of(Duration.ofMinutes(95), Duration.ofHours(3), Duration.ofMinutes(290))) {
            for (FitnessLevel level : FitnessLevel.values()) {
                PaceSet paces = paceModel.derivePaces(RaceCatalog.LIDINGO, goal, level);

                assertTrue(paces.pace(PaceZone.EASY).compareTo(paces.pace(PaceZone.TEMPO)) > 0, level + " easy vs tempo");
                assertTrue(paces.pace(PaceZone.TEMPO).compareTo(paces.pace(PaceZone.THRESHOLD)) > 0, level + " tempo vs threshold");
                assertTrue(paces.pace(PaceZone.THRESHOLD).compareTo(paces.pace(PaceZone.INTERVAL)) > 0, level + " threshold vs interval");
            }
        }
    }

    @Test
    void beginnersGetTheWidestEasyToRaceGap() {
        Duration goal = Duration.ofHours(3);
        PaceSet beginner = paceModel.derivePaces(RaceCatalog.LIDINGO, goal, FitnessLevel.BEGINNER);
        PaceSet intermediate = paceModel.derivePaces(RaceCatalog.LIDINGO, goal, FitnessLevel.INTERMEDIATE);
        PaceSet advanced = paceModel.derivePaces(RaceCatalog.LIDINGO, goal, FitnessLevel.ADVANCED);

        assertEquals(beginner.pace(PaceZone.RACE), advanced.pace(PaceZone.RACE));
        assertTrue(beginner.pace(PaceZone.EASY).compareTo(intermediate.pace(PaceZone.EASY)) > 0);
        assertTrue(intermediate.pace(PaceZone.EASY).compareTo(advanced.pace(PaceZone.EASY)) > 0);
    }

    @Test
    void rejectsNonPositiveGoalTime() {
        assertThrows(InvalidInputException.class,
                () -> paceModel.derivePaces(RaceCatalog.LIDINGO, Duration.ZERO, FitnessLevel.BEGINNER));
        assertThrows(InvalidInputException.class,
                () -> paceModel.derivePaces(RaceCatalog.LIDINGO, Duration.ofMinutes(-5), FitnessLevel.BEGINNER));
        assertThrows(InvalidInputException.class,
                () -> paceModel.derivePaces(RaceCatalog.LIDINGO, null, FitnessLevel.BEGINNER));
    }

    @Test
    void rejectsUnknownRace() {
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> paceModel.derivePaces("boston", Duration.ofHours(3), FitnessLevel.ADVANCED));

        assertEquals(InvalidInputException.CODE, e.getErrorCode());
        assertTrue(e.getMessage().contains("lidingo"));
    }

    @Test
    void rejectsRaceWithoutDistance() {
        Race noDistance = new Race("fun-run", "Fun run", 0, "Anywhere", "", 0, "", List.of());

        assertThrows(InvalidInputException.class,
                () -> paceModel.derivePaces(noDistance, Duration.ofHours(1), FitnessLevel.BEGINNER));
    }
}
