package com.bko.racebuddy.race;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Races the planner knows the distance of. Read-only after construction.
 */
@Component
public class RaceCatalog {
    public static final String LIDINGO = "lidingo";

    private final Map<String, Race> races;
    private final List<String> order;

    public RaceCatalog() {
        this(List.of(Lidingoloppet.race()));
    }

    public RaceCatalog(List<Race> races) {
        Map<String, Race> byId = new LinkedHashMap<>();
        for (Race race : races) {
            byId.put(normalize(race.id()), race);
        }
        this.races = Map.copyOf(byId);
        this.order = List.copyOf(byId.keySet());
    }

    public Optional<Race> find(String raceId) {
        if (raceId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(races.get(normalize(raceId)));
    }

    public List<Race> list() {
        List<Race> result = new ArrayList<>();
        for (String id : order) {
            result.add(races.get(id));
        }
        return List.copyOf(result);
    }

    private static String normalize(String raceId) {
        return raceId.trim().toLowerCase(Locale.ROOT);
    }
}
