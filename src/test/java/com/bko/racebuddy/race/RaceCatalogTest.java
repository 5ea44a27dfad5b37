package com.bko.racebuddy.race;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RaceCatalogTest {

    @Test
    void knowsLidingoloppet() {
        Race race = new RaceCatalog().find(RaceCatalog.LIDINGO).orElseThrow();

        assertEquals("Lidingöloppet", race.name());
        assertEquals(30.0, race.distanceKm());
        assertEquals(400, race.elevationGainM());
        assertEquals(5, race.keyChallenges().size());
        assertEquals(3, race.tips().raceDayTips().size());
        assertEquals(List.of("10km", "20km", "25km", "finish"),
                List.copyOf(race.statistics().commonSplits().keySet()));
    }

    @Test
    void lookupIgnoresCaseAndWhitespace() {
        RaceCatalog catalog = new RaceCatalog();

        assertTrue(catalog.find(" Lidingo ").isPresent());
        assertTrue(catalog.find("boston").isEmpty());
        assertTrue(catalog.find(null).isEmpty());
    }

    @Test
    void listsRacesInRegistrationOrder() {
        Race second = new Race("trail-10", "Trail 10", 10.0, "Täby", "Short trail race.", 120, "Dry", List.of());
        Race first = new Race("city-half", "City Half", 21.1, "Stockholm", "Flat road half marathon.", 40, "Mild", List.of());

        RaceCatalog catalog = new RaceCatalog(List.of(second, first));

        assertEquals(List.of(second, first), catalog.list());
        assertNull(catalog.find("trail-10").orElseThrow().tips());
    }
}
