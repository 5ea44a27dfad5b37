package com.bko.racebuddy.shared;

import java.time.DayOfWeek;

/**
 * Process-wide planner settings.
 *
 * @param longRunDay     weekday the long run is pinned to, or {@code null} for the last training day of each week
 * @param tablesResource classpath location of the training tables
 */
public record PlannerSettings(DayOfWeek longRunDay, String tablesResource) {
    public static final String DEFAULT_TABLES_RESOURCE = "training-tables.json";

    public PlannerSettings {
        if (tablesResource == null || tablesResource.isBlank()) {
            tablesResource = DEFAULT_TABLES_RESOURCE;
        }
    }

    public static PlannerSettings defaults() {
        return new PlannerSettings(null, DEFAULT_TABLES_RESOURCE);
    }

    public boolean hasLongRunDay() {
        return longRunDay != null;
    }
}
