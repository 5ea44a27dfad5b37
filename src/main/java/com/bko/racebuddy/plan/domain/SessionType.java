package com.bko.racebuddy.plan.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SessionType {
    EASY_RUN("easy_run", "Easy run", "low", PaceZone.EASY,
            "Run %s km at a relaxed pace. Focus on form and breathing."),
    LONG_RUN("long_run", "Long run", "low-medium", PaceZone.EASY,
            "Long run of %s km at a steady pace to build endurance."),
    TEMPO("tempo", "Tempo run", "medium", PaceZone.TEMPO,
            "Run %s km at a comfortably hard pace, close to your goal race effort."),
    INTERVAL("interval", "Interval training", "high", PaceZone.INTERVAL,
            "Intervals totalling %s km. Alternate hard repeats with easy jogging recoveries."),
    CROSS_TRAIN("cross_train", "Cross training", "low", null,
            "Low-impact cross training such as cycling or swimming."),
    REST("rest", "Rest", "none", null,
            "Rest day. Let the body absorb the training.");

    private final String code;
    private final String title;
    private final String intensity;
    private final PaceZone paceZone;
    private final String descriptionFormat;

    SessionType(String code, String title, String intensity, PaceZone paceZone, String descriptionFormat) {
        this.code = code;
        this.title = title;
        this.intensity = intensity;
        this.paceZone = paceZone;
        this.descriptionFormat = descriptionFormat;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String title() {
        return title;
    }

    public String intensity() {
        return intensity;
    }

    /**
     * Zone the session is run at, or {@code null} when the session has no running pace.
     */
    public PaceZone paceZone() {
        return paceZone;
    }

    public boolean isRun() {
        return paceZone != null;
    }

    public String describe(double distanceKm) {
        return String.format(Locale.ROOT, descriptionFormat, formatKm(distanceKm));
    }

    @JsonCreator
    public static SessionType fromCode(String code) {
        return Codes.lookup(SessionType.class, values(), code, SessionType::code);
    }

    private static String formatKm(double distanceKm) {
        if (distanceKm == Math.rint(distanceKm)) {
            return String.valueOf((long) distanceKm);
        }
        return String.format(Locale.ROOT, "%.1f", distanceKm);
    }
}
