package com.bko.racebuddy.shared;

import io.github.cdimascio.dotenv.Dotenv;
import org.springframework.stereotype.Component;

@Component
public class EnvConfig {
    private final Dotenv dotenv;

    public EnvConfig() {
        this(Dotenv.configure()
                .ignoreIfMissing()
                .load());
    }

    EnvConfig(Dotenv dotenv) {
        this.dotenv = dotenv;
    }

    /**
     * Looks up a dotted key such as {@code planner.long_run_day} as {@code PLANNER_LONG_RUN_DAY},
     * first in the {@code .env} file and then in the process environment.
     */
    public String get(String key) {
        String envKey = toEnvKey(key);
        String value = dotenv.get(envKey);
        if (value == null) {
            value = System.getenv(envKey);
        }
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    static String toEnvKey(String key) {
        return key.toUpperCase()
                .replace(".", "_")
                .replace("-", "_");
    }
}
