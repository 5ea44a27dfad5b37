package com.bko.racebuddy.plan.app;

import com.bko.racebuddy.plan.domain.FitnessLevel;
import com.bko.racebuddy.plan.domain.PaceZone;
import com.bko.racebuddy.plan.domain.Phase;
import com.bko.racebuddy.plan.domain.SessionType;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only planning constants: per-level volumes, pace multipliers and session weights, the phase
 * split and the session templates keyed by phase and training days per week.
 * Loaded once from a JSON classpath resource and shared by every generation call.
 */
public final class TrainingTables {
    public static final int MIN_TRAINING_DAYS = 3;
    public static final int MAX_TRAINING_DAYS = 7;

    private final PhaseSplit phaseSplit;
    private final int recoveryInterval;
    private final double recoveryFactor;
    private final double taperFloorRatio;
    private final int crossTrainMinutes;
    private final Map<FitnessLevel, LevelTable> levels;
    private final Map<Phase, Map<Integer, List<SessionType>>> templates;

    TrainingTables(PhaseSplit phaseSplit,
                   int recoveryInterval,
                   double recoveryFactor,
                   double taperFloorRatio,
                   int crossTrainMinutes,
                   Map<FitnessLevel, LevelTable> levels,
                   Map<Phase, Map<Integer, List<SessionType>>> templates) {
        this.phaseSplit = phaseSplit;
        this.recoveryInterval = recoveryInterval;
        this.recoveryFactor = recoveryFactor;
        this.taperFloorRatio = taperFloorRatio;
        this.crossTrainMinutes = crossTrainMinutes;
        this.levels = levels;
        this.templates = templates;
        validate();
    }

    public static TrainingTables load(ObjectMapper objectMapper, String resource) throws IOException {
        ClassLoader classLoader = TrainingTables.class.getClassLoader();
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new FileNotFoundException("Training tables not found on classpath: " + resource);
            }
            return fromDocument(objectMapper.readValue(in, TablesDocument.class));
        }
    }

    static TrainingTables fromDocument(TablesDocument document) {
        if (document.phaseSplit() == null || document.levels() == null || document.templates() == null) {
            throw new IllegalStateException("Invalid training tables: phaseSplit, levels and templates are required");
        }

        Map<FitnessLevel, LevelTable> levels = new EnumMap<>(FitnessLevel.class);
        document.levels().forEach((code, level) -> levels.put(FitnessLevel.fromCode(code), toLevelTable(level)));

        Map<Phase, Map<Integer, List<SessionType>>> templates = new EnumMap<>(Phase.class);
        document.templates().forEach((phaseCode, byDays) -> {
            Map<Integer, List<SessionType>> phaseTemplates = new TreeMap<>();
            byDays.forEach((days, types) -> phaseTemplates.put(Integer.valueOf(days.trim()),
                    types.stream().map(SessionType::fromCode).toList()));
            templates.put(Phase.fromCode(phaseCode), Collections.unmodifiableMap(phaseTemplates));
        });

        return new TrainingTables(
                document.phaseSplit(),
                document.recoveryInterval(),
                document.recoveryFactor(),
                document.taperFloorRatio(),
                document.crossTrainMinutes(),
                Collections.unmodifiableMap(levels),
                Collections.unmodifiableMap(templates)
        );
    }

    private static LevelTable toLevelTable(LevelDocument document) {
        Map<PaceZone, Double> multipliers = new EnumMap<>(PaceZone.class);
        if (document.paceMultipliers() != null) {
            document.paceMultipliers().forEach((zone, value) -> multipliers.put(PaceZone.fromCode(zone), value));
        }
        Map<SessionType, Double> weights = new EnumMap<>(SessionType.class);
        if (document.sessionWeights() != null) {
            document.sessionWeights().forEach((type, value) -> weights.put(SessionType.fromCode(type), value));
        }
        return new LevelTable(document.startVolumeKm(), document.peakVolumeKm(),
                Collections.unmodifiableMap(multipliers), Collections.unmodifiableMap(weights));
    }

    public PhaseSplit phaseSplit() {
        return phaseSplit;
    }

    public int recoveryInterval() {
        return recoveryInterval;
    }

    public double recoveryFactor() {
        return recoveryFactor;
    }

    public double taperFloorRatio() {
        return taperFloorRatio;
    }

    public int crossTrainMinutes() {
        return crossTrainMinutes;
    }

    public LevelTable level(FitnessLevel level) {
        return levels.get(level);
    }

    /**
     * Session types to schedule in a week, long run first. The list size equals {@code trainingDays}.
     */
    public List<SessionType> template(Phase phase, int trainingDays) {
        List<SessionType> template = templates.get(phase).get(trainingDays);
        if (template == null) {
            throw new IllegalArgumentException("No session template for " + phase.code() + " with " + trainingDays + " days");
        }
        return template;
    }

    private void validate() {
        check(phaseSplit.base() > 0 && phaseSplit.peak() > 0 && phaseSplit.taper() > 0
                && phaseSplit.base() + phaseSplit.peak() + phaseSplit.taper() < 1.0,
                "phase split fractions must be positive and leave room for the build phase");
        check(recoveryInterval >= 2, "recoveryInterval must be at least 2");
        check(recoveryFactor > 0 && recoveryFactor < 1, "recoveryFactor must be between 0 and 1");
        check(taperFloorRatio > 0 && taperFloorRatio < 1, "taperFloorRatio must be between 0 and 1");
        check(crossTrainMinutes >= 0, "crossTrainMinutes must not be negative");

        for (FitnessLevel level : FitnessLevel.values()) {
            LevelTable table = levels.get(level);
            check(table != null, "missing level " + level.code());
            check(table.startVolumeKm() > 0 && table.peakVolumeKm() >= table.startVolumeKm(),
                    level.code() + ": volumes must be positive and peak must not be below start");
            for (PaceZone zone : PaceZone.values()) {
                Double multiplier = table.paceMultipliers().get(zone);
                check(multiplier != null && multiplier > 0, level.code() + ": missing pace multiplier " + zone.code());
            }
            check(table.paceMultiplier(PaceZone.EASY) > table.paceMultiplier(PaceZone.TEMPO)
                            && table.paceMultiplier(PaceZone.TEMPO) > table.paceMultiplier(PaceZone.THRESHOLD)
                            && table.paceMultiplier(PaceZone.THRESHOLD) > table.paceMultiplier(PaceZone.INTERVAL),
                    level.code() + ": pace multipliers must get faster from easy to interval");
            double longRunWeight = table.sessionWeight(SessionType.LONG_RUN);
            check(longRunWeight > 0, level.code() + ": long run weight must be positive");
            for (SessionType type : SessionType.values()) {
                check(table.sessionWeight(type) >= 0 && table.sessionWeight(type) <= longRunWeight,
                        level.code() + ": weight of " + type.code() + " must be between 0 and the long run weight");
            }
        }

        for (Phase phase : Phase.values()) {
            Map<Integer, List<SessionType>> byDays = templates.get(phase);
            check(byDays != null, "missing templates for phase " + phase.code());
            for (int days = MIN_TRAINING_DAYS; days <= MAX_TRAINING_DAYS; days++) {
                List<SessionType> template = byDays.get(days);
                String name = phase.code() + "/" + days;
                check(template != null && template.size() == days, "template " + name + " must list " + days + " sessions");
                check(template.stream().filter(type -> type == SessionType.LONG_RUN).count() == 1,
                        "template " + name + " must contain exactly one long run");
                check(!template.contains(SessionType.REST), "template " + name + " must not contain rest days");
            }
        }
    }

    private static void check(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException("Invalid training tables: " + message);
        }
    }

    public record PhaseSplit(double base, double peak, double taper) {
    }

    public record LevelTable(
            double startVolumeKm,
            double peakVolumeKm,
            Map<PaceZone, Double> paceMultipliers,
            Map<SessionType, Double> sessionWeights
    ) {
        public double paceMultiplier(PaceZone zone) {
            return paceMultipliers.get(zone);
        }

        public double sessionWeight(SessionType type) {
            return sessionWeights.getOrDefault(type, 0.0);
        }
    }

    record TablesDocument(
            PhaseSplit phaseSplit,
            int recoveryInterval,
            double recoveryFactor,
            double taperFloorRatio,
            int crossTrainMinutes,
            Map<String, LevelDocument> levels,
            Map<String, Map<String, List<String>>> templates
    ) {
    }

    record LevelDocument(
            double startVolumeKm,
            double peakVolumeKm,
            Map<String, Double> paceMultipliers,
            Map<String, Double> sessionWeights
    ) {
    }
}
