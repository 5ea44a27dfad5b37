package com.bko.racebuddy.plan;

import com.bko.racebuddy.plan.domain.RacePlanRequest;
import com.bko.racebuddy.plan.domain.TrainingPlan;

public interface GenerateTrainingPlanUseCase {
    /**
     * Generates the complete periodized plan for one request. Either the whole plan is returned
     * or a {@link com.bko.racebuddy.plan.domain.PlanGenerationException} is thrown.
     *
     * @param request a request whose field ranges and date ordering have already been validated
     * @return the plan, with sessions ordered by week and date
     */
    TrainingPlan generate(RacePlanRequest request);
}
