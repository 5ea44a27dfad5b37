package com.bko.racebuddy.plan.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Phase {
    BASE("base", "Base building"),
    BUILD("build", "Strength and speed"),
    PEAK("peak", "Race preparation"),
    TAPER("taper", "Taper");

    private final String code;
    private final String focus;

    Phase(String code, String focus) {
        this.code = code;
        this.focus = focus;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Label shown next to every session of a week in this phase.
     */
    public String focus() {
        return focus;
    }

    @JsonCreator
    public static Phase fromCode(String code) {
        return Codes.lookup(Phase.class, values(), code, Phase::code);
    }
}
