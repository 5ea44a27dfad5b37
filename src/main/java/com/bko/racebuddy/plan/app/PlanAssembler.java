package com.bko.racebuddy.plan.app;

import com.bko.racebuddy.plan.GenerateTrainingPlanUseCase;
import com.bko.racebuddy.plan.domain.PaceSet;
import com.bko.racebuddy.plan.domain.PlanSummary;
import com.bko.racebuddy.plan.domain.Profile;
import com.bko.racebuddy.plan.domain.RacePlanRequest;
import com.bko.racebuddy.plan.domain.Session;
import com.bko.racebuddy.plan.domain.TrainingPlan;
import com.bko.racebuddy.plan.domain.WeekPlan;
import com.bko.racebuddy.race.Race;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class PlanAssembler implements GenerateTrainingPlanUseCase {
    private static final Logger logger = LoggerFactory.getLogger(PlanAssembler.class);

    private final PaceModel paceModel;
    private final PeriodizationPlanner periodizationPlanner;
    private final SessionScheduler sessionScheduler;

    public PlanAssembler(PaceModel paceModel,
                         PeriodizationPlanner periodizationPlanner,
                         SessionScheduler sessionScheduler) {
        this.paceModel = paceModel;
        this.periodizationPlanner = periodizationPlanner;
        this.sessionScheduler = sessionScheduler;
    }

    @Override
    public TrainingPlan generate(RacePlanRequest request) {
        Profile profile = request.profile();
        SessionScheduler.validateTrainingDays(profile.trainingDaysPerWeek());
        Race race = paceModel.resolveRace(request.raceId());
        int totalWeeks = PeriodizationPlanner.totalWeeks(request.startDate(), request.raceDate());
        logger.info("Generating {}-week plan for {} ({}, {} days/week)",
                totalWeeks, race.id(), profile.fitnessLevel(), profile.trainingDaysPerWeek());

        PaceSet paces = paceModel.derivePaces(race, request.targetTime(), profile.fitnessLevel());
        List<WeekPlan> weeks = periodizationPlanner.plan(totalWeeks, profile.fitnessLevel(), request.startDate());

        List<Session> sessions = new ArrayList<>();
        for (WeekPlan week : weeks) {
            sessions.addAll(sessionScheduler.schedule(week, profile.trainingDaysPerWeek(), paces, profile.fitnessLevel()));
        }

        double totalDistance = 0;
        for (Session session : sessions) {
            totalDistance += session.distanceKm();
        }

        PlanSummary summary = new PlanSummary(
                race.id(),
                race.name(),
                race.distanceKm(),
                weeks.size(),
                Distances.round(totalDistance),
                request.startDate(),
                request.raceDate(),
                profile.gender(),
                profile.age(),
                profile.fitnessLevel(),
                request.targetTime(),
                profile.trainingDaysPerWeek(),
                paces
        );
        logger.info("Generated plan for {}: {} weeks, {} sessions, {} km",
                race.id(), summary.totalWeeks(), sessions.size(), summary.totalDistanceKm());
        return new TrainingPlan(summary, weeks, sessions);
    }
}
