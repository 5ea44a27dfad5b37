package com.bko.racebuddy.plan.web;

import com.bko.racebuddy.plan.domain.FitnessLevel;
import com.bko.racebuddy.plan.domain.Gender;
import com.bko.racebuddy.plan.domain.Profile;
import com.bko.racebuddy.plan.domain.RacePlanRequest;
import com.bko.racebuddy.plan.web.dto.PlanRequestDto;
import com.bko.racebuddy.race.RaceCatalog;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Maps a validated request onto the planner's request type: resolves gender and fitness level
 * codes, parses times and fills in the defaults.
 */
@Component
public class PlanRequestMapper {
    static final int DEFAULT_TRAINING_DAYS = 4;

    public RacePlanRequest toRequest(PlanRequestDto dto) {
        Gender gender = Gender.fromCode(dto.gender());
        FitnessLevel fitnessLevel = FitnessLevel.fromCode(dto.fitnessLevel());
        int trainingDays = dto.trainingDaysPerWeek() == null ? DEFAULT_TRAINING_DAYS : dto.trainingDaysPerWeek();

        List<Duration> priorRaceTimes = new ArrayList<>();
        if (dto.previousRaceTimes() != null) {
            for (String time : dto.previousRaceTimes()) {
                priorRaceTimes.add(parseTime(time));
            }
        }
        Set<String> injuries = new LinkedHashSet<>();
        if (dto.injuries() != null) {
            for (String injury : dto.injuries()) {
                if (injury != null && !injury.isBlank()) {
                    injuries.add(injury.trim());
                }
            }
        }

        Profile profile = new Profile(gender, dto.heightCm(), dto.weightKg(), dto.age(), fitnessLevel,
                trainingDays, priorRaceTimes, injuries);
        String race = dto.race() == null || dto.race().isBlank() ? RaceCatalog.LIDINGO : dto.race().trim();
        return new RacePlanRequest(profile, race, parseTime(dto.targetTime()), dto.startDate(), dto.raceDate());
    }

    /**
     * Parses a time already matched against {@link PlanRequestDto#TIME_PATTERN}.
     */
    static Duration parseTime(String value) {
        String[] parts = value.trim().split(":");
        return Duration.ofHours(Integer.parseInt(parts[0]))
                .plusMinutes(Integer.parseInt(parts[1]))
                .plusSeconds(Integer.parseInt(parts[2]));
    }
}
