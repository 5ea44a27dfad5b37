package com.bko.racebuddy.shared;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.DayOfWeek;
import java.util.Locale;

@Configuration
public class SettingsConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(SettingsConfiguration.class);

    @Bean
    public PlannerSettings plannerSettings(EnvConfig envConfig) {
        DayOfWeek longRunDay = parseDay(envConfig.get("planner.long_run_day"));
        String tablesResource = envConfig.get("planner.tables_resource");
        PlannerSettings settings = new PlannerSettings(longRunDay, tablesResource);
        logger.info("Planner settings: long run day={}, tables={}",
                settings.hasLongRunDay() ? settings.longRunDay() : "last training day",
                settings.tablesResource());
        return settings;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    static DayOfWeek parseDay(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return DayOfWeek.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("PLANNER_LONG_RUN_DAY must be a weekday name such as SUNDAY, got: " + value, e);
        }
    }
}
