package com.bko.racebuddy.plan.domain;

import java.util.Locale;
import java.util.function.Function;

final class Codes {

    private Codes() {
    }

    static <E extends Enum<E>> E lookup(Class<E> type, E[] values, String code, Function<E, String> codeOf) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (E value : values) {
                if (codeOf.apply(value).equals(normalized)) {
                    return value;
                }
            }
        }
        throw new InvalidInputException("Unknown " + type.getSimpleName() + ": " + code);
    }
}
