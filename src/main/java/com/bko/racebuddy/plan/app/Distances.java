package com.bko.racebuddy.plan.app;

final class Distances {

    private Distances() {
    }

    /**
     * Rounds to 0.1 km.
     */
    static double round(double km) {
        return Math.round(km * 10.0) / 10.0;
    }
}
