package com.bko.racebuddy.plan.web.dto;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlanRequestDtoTest {
    private static final LocalDate START = LocalDate.of(2024, 1, 1);
    private static final LocalDate RACE = LocalDate.of(2024, 3, 25);

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        factory.close();
    }

    private static PlanRequestDto request(Double heightCm, Double weightKg, Integer age, String targetTime,
                                          List<String> previousTimes, LocalDate start, LocalDate race) {
        return new PlanRequestDto("female", heightCm, weightKg, age, "intermediate", 4,
                previousTimes, List.of("old ankle sprain"), "lidingo", targetTime, start, race);
    }

    private static Set<String> messages(PlanRequestDto dto) {
        return validator.validate(dto).stream()
                .map(ConstraintViolation::getMessage)
                .collect(Collectors.toSet());
    }

    @Test
    void acceptsValidRequest() {
        assertTrue(messages(request(168.0, 60.0, 34, "03:00:00", List.of("3:15:00"), START, RACE)).isEmpty());
    }

    @Test
    void acceptsRangeBoundaries() {
        assertTrue(messages(request(100.0, 30.0, 18, "0:59:59", null, START, RACE)).isEmpty());
        assertTrue(messages(request(250.0, 200.0, 100, "23:59:59", null, START, RACE)).isEmpty());
    }

    @Test
    void rejectsBiometricsOutOfRange() {
        assertEquals(Set.of("heightCm must be between 100 and 250."),
                messages(request(99.5, 60.0, 34, "03:00:00", null, START, RACE)));
        assertEquals(Set.of("weightKg must be between 30 and 200."),
                messages(request(168.0, 200.1, 34, "03:00:00", null, START, RACE)));
        assertEquals(Set.of("age must be between 18 and 100."),
                messages(request(168.0, 60.0, 101, "03:00:00", null, START, RACE)));
    }

    @Test
    void rejectsMissingFields() {
        PlanRequestDto dto = new PlanRequestDto(" ", null, null, null, null, null,
                null, null, null, null, null, null);

        assertEquals(Set.of("gender is required.", "heightCm is required.", "weightKg is required.",
                        "age is required.", "fitnessLevel is required.", "targetTime is required.",
                        "startDate is required.", "raceDate is required."),
                messages(dto));
    }

    @Test
    void rejectsMalformedTimes() {
        for (String time : List.of("2:30", "24:00:00", "02:61:00", "ab:cd:ef", "02:30:00:00")) {
            assertEquals(Set.of("targetTime must be in HH:MM:SS format."),
                    messages(request(168.0, 60.0, 34, time, null, START, RACE)), time);
        }
        assertEquals(Set.of("previousRaceTimes must be in HH:MM:SS format."),
                messages(request(168.0, 60.0, 34, "03:00:00", List.of("3h15"), START, RACE)));
    }

    @Test
    void rejectsRaceDateNotAfterStart() {
        assertEquals(Set.of("Race date must be after start date."),
                messages(request(168.0, 60.0, 34, "03:00:00", null, RACE, RACE)));
        assertEquals(Set.of("Race date must be after start date."),
                messages(request(168.0, 60.0, 34, "03:00:00", null, RACE, START)));
    }
}
