package com.bko.racebuddy.plan.web;

import com.bko.racebuddy.plan.GenerateTrainingPlanUseCase;
import com.bko.racebuddy.plan.domain.RacePlanRequest;
import com.bko.racebuddy.plan.domain.TrainingPlan;
import com.bko.racebuddy.plan.web.dto.PlanRequestDto;
import com.bko.racebuddy.plan.web.dto.PlanResponseDto;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

@RestController
@RequestMapping("/api/plans")
public class PlanController {
    private final GenerateTrainingPlanUseCase generateTrainingPlanUseCase;
    private final PlanRequestMapper requestMapper;
    private final Clock clock;

    public PlanController(GenerateTrainingPlanUseCase generateTrainingPlanUseCase,
                          PlanRequestMapper requestMapper,
                          Clock clock) {
        this.generateTrainingPlanUseCase = generateTrainingPlanUseCase;
        this.requestMapper = requestMapper;
        this.clock = clock;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public PlanResponseDto generate(@Valid @RequestBody PlanRequestDto requestDto) {
        RacePlanRequest request = requestMapper.toRequest(requestDto);
        TrainingPlan plan = generateTrainingPlanUseCase.generate(request);
        return PlanResponseDto.from(plan, Instant.now(clock));
    }
}
