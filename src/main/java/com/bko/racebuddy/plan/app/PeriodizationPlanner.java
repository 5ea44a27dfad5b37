package com.bko.racebuddy.plan.app;

import com.bko.racebuddy.plan.domain.FitnessLevel;
import com.bko.racebuddy.plan.domain.InsufficientTimeException;
import com.bko.racebuddy.plan.domain.InvalidInputException;
import com.bko.racebuddy.plan.domain.Phase;
import com.bko.racebuddy.plan.domain.WeekPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits the weeks before a race into base, build, peak and taper phases and sets each week's
 * target distance.
 *
 * <p>Outside the taper, volume climbs linearly from the level's start volume to its peak volume,
 * except that every {@code recoveryInterval}-th week steps back to a fraction of the week before.
 * Taper weeks fall linearly from the highest volume reached down to {@code taperFloorRatio} of it.
 */
@Component
public class PeriodizationPlanner {
    private static final Logger logger = LoggerFactory.getLogger(PeriodizationPlanner.class);

    public static final int MIN_WEEKS = 2;
    static final int MIN_WEEKS_FOR_RECOVERY = 4;
    private static final double EPSILON = 1e-9;

    private final TrainingTables tables;

    public PeriodizationPlanner(TrainingTables tables) {
        this.tables = tables;
    }

    /**
     * Whole weeks between the two dates, rounded down, at least one.
     */
    public static int totalWeeks(LocalDate startDate, LocalDate raceDate) {
        long days = ChronoUnit.DAYS.between(startDate, raceDate);
        return (int) Math.max(1, Math.floorDiv(days, 7));
    }

    public List<WeekPlan> plan(int totalWeeks, FitnessLevel level, LocalDate startDate) {
        if (totalWeeks < MIN_WEEKS) {
            throw new InsufficientTimeException(totalWeeks, MIN_WEEKS);
        }
        if (level == null) {
            throw new InvalidInputException("Fitness level is required.");
        }

        TrainingTables.LevelTable table = tables.level(level);
        List<Phase> phases = allocatePhases(totalWeeks);
        boolean[] recovery = new boolean[totalWeeks + 1];
        int loadingWeeks = 0;
        int taperWeeks = 0;
        for (int week = 1; week <= totalWeeks; week++) {
            Phase phase = phases.get(week - 1);
            if (phase == Phase.TAPER) {
                taperWeeks++;
                continue;
            }
            recovery[week] = totalWeeks >= MIN_WEEKS_FOR_RECOVERY && week % tables.recoveryInterval() == 0;
            if (!recovery[week]) {
                loadingWeeks++;
            }
        }

        List<WeekPlan> weeks = new ArrayList<>(totalWeeks);
        double previous = 0;
        double highest = 0;
        int loadingIndex = 0;
        int taperIndex = 0;
        for (int week = 1; week <= totalWeeks; week++) {
            Phase phase = phases.get(week - 1);
            double volume;
            if (phase == Phase.TAPER) {
                taperIndex++;
                double drop = (1.0 - tables.taperFloorRatio()) * taperIndex / taperWeeks;
                volume = Distances.round(highest * (1.0 - drop));
            } else if (recovery[week]) {
                volume = Distances.round(previous * tables.recoveryFactor());
            } else {
                volume = Distances.round(loadingVolume(loadingIndex++, loadingWeeks, table));
                highest = Math.max(highest, volume);
            }
            logger.debug("Week {}: {} {} km{}", week, phase.code(), volume, recovery[week] ? " (recovery)" : "");
            weeks.add(WeekPlan.of(week, phase, volume, recovery[week], startDate));
            previous = volume;
        }
        return Collections.unmodifiableList(weeks);
    }

    /**
     * Phase of every week, in order. Two and three week plans cannot hold all four phases and
     * become base+taper and base+build+taper.
     */
    List<Phase> allocatePhases(int totalWeeks) {
        if (totalWeeks == 2) {
            return List.of(Phase.BASE, Phase.TAPER);
        }
        if (totalWeeks == 3) {
            return List.of(Phase.BASE, Phase.BUILD, Phase.TAPER);
        }

        TrainingTables.PhaseSplit split = tables.phaseSplit();
        int base = Math.max(1, (int) Math.floor(split.base() * totalWeeks + EPSILON));
        int peak = Math.max(1, (int) Math.round(split.peak() * totalWeeks));
        int taper = Math.max(1, (int) Math.ceil(split.taper() * totalWeeks - EPSILON));
        int build = totalWeeks - base - peak - taper;
        while (build < 1) {
            if (base > 1) {
                base--;
            } else if (peak > 1) {
                peak--;
            } else {
                taper--;
            }
            build = totalWeeks - base - peak - taper;
        }

        List<Phase> phases = new ArrayList<>(totalWeeks);
        phases.addAll(Collections.nCopies(base, Phase.BASE));
        phases.addAll(Collections.nCopies(build, Phase.BUILD));
        phases.addAll(Collections.nCopies(peak, Phase.PEAK));
        phases.addAll(Collections.nCopies(taper, Phase.TAPER));
        return phases;
    }

    private double loadingVolume(int index, int count, TrainingTables.LevelTable table) {
        if (count <= 1) {
            return table.startVolumeKm();
        }
        double progress = (double) index / (count - 1);
        return table.startVolumeKm() + (table.peakVolumeKm() - table.startVolumeKm()) * progress;
    }
}
