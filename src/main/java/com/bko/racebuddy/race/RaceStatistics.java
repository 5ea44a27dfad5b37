package com.bko.racebuddy.race;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Historical field statistics. Times are {@code H:MM:SS} strings as published by the organiser.
 */
public record RaceStatistics(
        Participation participation,
        Map<String, FinishTimes> finishTimes,
        Map<String, AgeGroup> ageGroups,
        Map<String, String> commonSplits
) {
    public RaceStatistics {
        finishTimes = ordered(finishTimes);
        ageGroups = ordered(ageGroups);
        commonSplits = ordered(commonSplits);
    }

    private static <V> Map<String, V> ordered(Map<String, V> values) {
        return values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public record Participation(int averageParticipants, double completionRate, String growthTrend) {
    }

    public record FinishTimes(String average, String median, String percentile25, String percentile75) {
    }

    public record AgeGroup(String averageTime, int participants) {
    }
}
