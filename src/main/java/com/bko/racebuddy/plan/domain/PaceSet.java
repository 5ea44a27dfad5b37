package com.bko.racebuddy.plan.domain;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Time per kilometre for every {@link PaceZone}.
 */
public record PaceSet(Map<PaceZone, Duration> paces) {
    public PaceSet {
        EnumMap<PaceZone, Duration> copy = new EnumMap<>(PaceZone.class);
        copy.putAll(paces);
        for (PaceZone zone : PaceZone.values()) {
            if (!copy.containsKey(zone)) {
                throw new IllegalArgumentException("Missing pace for zone " + zone.code());
            }
        }
        paces = Collections.unmodifiableMap(copy);
    }

    public Duration pace(PaceZone zone) {
        return paces.get(zone);
    }

    public String format(PaceZone zone) {
        return formatPace(pace(zone));
    }

    /**
     * Renders a pace as {@code m:ss/km}, rounded to the nearest second.
     */
    public static String formatPace(Duration pace) {
        if (pace == null) {
            return null;
        }
        long seconds = Math.round(pace.toMillis() / 1000.0);
        return String.format("%d:%02d/km", seconds / 60, seconds % 60);
    }
}
