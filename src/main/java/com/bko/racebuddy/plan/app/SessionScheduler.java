package com.bko.racebuddy.plan.app;

import com.bko.racebuddy.plan.domain.FitnessLevel;
import com.bko.racebuddy.plan.domain.InvalidScheduleConstraintException;
import com.bko.racebuddy.plan.domain.PaceSet;
import com.bko.racebuddy.plan.domain.Session;
import com.bko.racebuddy.plan.domain.SessionType;
import com.bko.racebuddy.plan.domain.WeekPlan;
import com.bko.racebuddy.shared.PlannerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.time.DayOfWeek.FRIDAY;
import static java.time.DayOfWeek.MONDAY;
import static java.time.DayOfWeek.SATURDAY;
import static java.time.DayOfWeek.SUNDAY;
import static java.time.DayOfWeek.THURSDAY;
import static java.time.DayOfWeek.TUESDAY;
import static java.time.DayOfWeek.WEDNESDAY;

/**
 * Turns one {@link WeekPlan} into seven dated sessions.
 */
@Component
public class SessionScheduler {
    private static final Logger logger = LoggerFactory.getLogger(SessionScheduler.class);

    /**
     * Weekdays picked as training days, first N for N training days per week.
     */
    static final List<DayOfWeek> TRAINING_DAY_PREFERENCE =
            List.of(MONDAY, WEDNESDAY, FRIDAY, SATURDAY, TUESDAY, THURSDAY, SUNDAY);

    private final TrainingTables tables;
    private final PlannerSettings settings;

    public SessionScheduler(TrainingTables tables, PlannerSettings settings) {
        this.tables = tables;
        this.settings = settings;
    }

    public List<Session> schedule(WeekPlan week, int trainingDaysPerWeek, PaceSet paces, FitnessLevel level) {
        validateTrainingDays(trainingDaysPerWeek);

        List<SessionType> template = tables.template(week.phase(), trainingDaysPerWeek);
        double[] distances = distribute(template, week.targetDistanceKm(), tables.level(level));
        Map<LocalDate, Integer> slotByDate = assignDays(week.dates(), template);

        List<Session> sessions = new ArrayList<>(WeekPlan.DAYS_PER_WEEK);
        for (LocalDate date : week.dates()) {
            Integer slot = slotByDate.get(date);
            if (slot == null) {
                sessions.add(session(week, date, SessionType.REST, 0.0, null));
            } else {
                SessionType type = template.get(slot);
                Duration pace = type.isRun() ? paces.pace(type.paceZone()) : null;
                sessions.add(session(week, date, type, distances[slot], pace));
            }
        }
        logger.debug("Week {} ({}): {} km across {} training days",
                week.weekNumber(), week.phase().code(), week.targetDistanceKm(), trainingDaysPerWeek);
        return Collections.unmodifiableList(sessions);
    }

    public static void validateTrainingDays(int trainingDaysPerWeek) {
        if (trainingDaysPerWeek < TrainingTables.MIN_TRAINING_DAYS || trainingDaysPerWeek > TrainingTables.MAX_TRAINING_DAYS) {
            throw new InvalidScheduleConstraintException(trainingDaysPerWeek,
                    TrainingTables.MIN_TRAINING_DAYS, TrainingTables.MAX_TRAINING_DAYS);
        }
    }

    /**
     * Splits the weekly target by session weight. Every share but the long run's is rounded to
     * 0.1 km and the long run takes what is left, so the shares add up to the target.
     */
    double[] distribute(List<SessionType> template, double targetKm, TrainingTables.LevelTable level) {
        double totalWeight = 0;
        for (SessionType type : template) {
            totalWeight += level.sessionWeight(type);
        }

        double[] distances = new double[template.size()];
        int longRunSlot = template.indexOf(SessionType.LONG_RUN);
        double assigned = 0;
        for (int i = 0; i < template.size(); i++) {
            if (i == longRunSlot) {
                continue;
            }
            distances[i] = Distances.round(targetKm * level.sessionWeight(template.get(i)) / totalWeight);
            assigned += distances[i];
        }
        distances[longRunSlot] = Distances.round(targetKm - assigned);
        return distances;
    }

    /**
     * Maps training dates to template slots. The long run goes to the configured weekday, or to
     * the last training date of the week; the remaining slots fill the other training dates in
     * date order.
     */
    Map<LocalDate, Integer> assignDays(List<LocalDate> dates, List<SessionType> template) {
        int trainingDays = template.size();
        Set<DayOfWeek> trainingWeekdays = EnumSet.noneOf(DayOfWeek.class);
        trainingWeekdays.addAll(TRAINING_DAY_PREFERENCE.subList(0, trainingDays));
        DayOfWeek longRunDay = settings.longRunDay();
        if (longRunDay != null && !trainingWeekdays.contains(longRunDay)) {
            trainingWeekdays.remove(TRAINING_DAY_PREFERENCE.get(trainingDays - 1));
            trainingWeekdays.add(longRunDay);
        }

        List<LocalDate> trainingDates = new ArrayList<>();
        for (LocalDate date : dates) {
            if (trainingWeekdays.contains(date.getDayOfWeek())) {
                trainingDates.add(date);
            }
        }

        LocalDate longRunDate = trainingDates.get(trainingDates.size() - 1);
        if (longRunDay != null) {
            for (LocalDate date : trainingDates) {
                if (date.getDayOfWeek() == longRunDay) {
                    longRunDate = date;
                }
            }
        }

        Map<LocalDate, Integer> slotByDate = new HashMap<>();
        int longRunSlot = template.indexOf(SessionType.LONG_RUN);
        slotByDate.put(longRunDate, longRunSlot);
        int slot = 0;
        for (LocalDate date : trainingDates) {
            if (date.equals(longRunDate)) {
                continue;
            }
            if (slot == longRunSlot) {
                slot++;
            }
            slotByDate.put(date, slot++);
        }
        return slotByDate;
    }

    private Session session(WeekPlan week, LocalDate date, SessionType type, double distanceKm, Duration pace) {
        return new Session(
                week.weekNumber(),
                date,
                date.getDayOfWeek().name(),
                type,
                distanceKm,
                pace,
                week.focus(),
                type.title(),
                type.describe(distanceKm),
                type.intensity(),
                durationMinutes(type, distanceKm, pace)
        );
    }

    private int durationMinutes(SessionType type, double distanceKm, Duration pace) {
        if (type == SessionType.CROSS_TRAIN) {
            return tables.crossTrainMinutes();
        }
        if (pace == null) {
            return 0;
        }
        return (int) Math.round(distanceKm * pace.toMillis() / 60_000.0);
    }
}
