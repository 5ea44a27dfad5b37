package com.bko.racebuddy.plan.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum FitnessLevel {
    BEGINNER("beginner"),
    INTERMEDIATE("intermediate"),
    ADVANCED("advanced");

    private final String code;

    FitnessLevel(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static FitnessLevel fromCode(String code) {
        return Codes.lookup(FitnessLevel.class, values(), code, FitnessLevel::code);
    }
}
