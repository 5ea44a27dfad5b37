package com.bko.racebuddy.race;

import java.util.List;

public record RaceTips(
        List<Tip> trainingTips,
        List<Tip> raceDayTips,
        List<WeatherAdvice> weatherPreparation
) {
    public RaceTips {
        trainingTips = trainingTips == null ? List.of() : List.copyOf(trainingTips);
        raceDayTips = raceDayTips == null ? List.of() : List.copyOf(raceDayTips);
        weatherPreparation = weatherPreparation == null ? List.of() : List.copyOf(weatherPreparation);
    }

    public record Tip(String category, String tip, String rationale) {
    }

    public record WeatherAdvice(String condition, String advice) {
    }
}
