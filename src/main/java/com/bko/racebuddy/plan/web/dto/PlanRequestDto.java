package com.bko.racebuddy.plan.web.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.util.List;

/**
 * Plan request as posted by the planner form. Enum-like fields stay strings here and are resolved
 * by the request mapper; training days per week are range-checked by the scheduler.
 */
public record PlanRequestDto(
        @NotBlank(message = "gender is required.")
        String gender,

        @NotNull(message = "heightCm is required.")
        @DecimalMin(value = "100", message = "heightCm must be between 100 and 250.")
        @DecimalMax(value = "250", message = "heightCm must be between 100 and 250.")
        Double heightCm,

        @NotNull(message = "weightKg is required.")
        @DecimalMin(value = "30", message = "weightKg must be between 30 and 200.")
        @DecimalMax(value = "200", message = "weightKg must be between 30 and 200.")
        Double weightKg,

        @NotNull(message = "age is required.")
        @Min(value = 18, message = "age must be between 18 and 100.")
        @Max(value = 100, message = "age must be between 18 and 100.")
        Integer age,

        @NotBlank(message = "fitnessLevel is required.")
        String fitnessLevel,

        Integer trainingDaysPerWeek,

        @Size(max = 20, message = "previousRaceTimes must not exceed 20 items.")
        List<@NotNull @Pattern(regexp = TIME_PATTERN, message = "previousRaceTimes must be in HH:MM:SS format.") String> previousRaceTimes,

        @Size(max = 20, message = "injuries must not exceed 20 items.")
        List<@Size(max = 200, message = "Each injury note must not exceed 200 characters.") String> injuries,

        String race,

        @NotBlank(message = "targetTime is required.")
        @Pattern(regexp = TIME_PATTERN, message = "targetTime must be in HH:MM:SS format.")
        String targetTime,

        @NotNull(message = "startDate is required.")
        LocalDate startDate,

        @NotNull(message = "raceDate is required.")
        LocalDate raceDate
) {
    /**
     * {@code HH:MM:SS}, hours 0-23.
     */
    public static final String TIME_PATTERN = "^([01]?\\d|2[0-3]):[0-5]\\d:[0-5]\\d$";

    @JsonIgnore
    @AssertTrue(message = "Race date must be after start date.")
    public boolean isRaceDateAfterStartDate() {
        return startDate == null || raceDate == null || startDate.isBefore(raceDate);
    }
}
