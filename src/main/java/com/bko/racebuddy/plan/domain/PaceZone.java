package com.bko.racebuddy.plan.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Named training intensities, listed from slowest to fastest running pace
 * with the race pace last.
 */
public enum PaceZone {
    EASY("easy"),
    TEMPO("tempo"),
    THRESHOLD("threshold"),
    INTERVAL("interval"),
    RACE("race");

    private final String code;

    PaceZone(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static PaceZone fromCode(String code) {
        return Codes.lookup(PaceZone.class, values(), code, PaceZone::code);
    }
}
