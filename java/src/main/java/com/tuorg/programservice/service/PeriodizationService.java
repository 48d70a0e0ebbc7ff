package com.tuorg.programservice.service;

import com.tuorg.programservice.model.BlockPhase;
import com.tuorg.programservice.model.EffortType;
import com.tuorg.programservice.model.ExperienceLevel;
import com.tuorg.programservice.model.PeriodizationModel;
import com.tuorg.programservice.model.ProgramGoal;
import com.tuorg.programservice.model.TrainingFocus;
import com.tuorg.programservice.model.VolumeRange;
import com.tuorg.programservice.model.WeekParameters;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Week-by-week intensity, volume and deload planning.
 *
 * <p>Every model produces a raw intensity in roughly 0.50..1.00 which is then
 * rescaled into the goal's range. Undulating and conjugate plans rotate their
 * session pattern by week number.
 */
@Service
public class PeriodizationService {

    static final double DELOAD_INTENSITY_FACTOR = 0.6;
    static final double DELOAD_VOLUME_FACTOR = 0.5;

    private static final Map<ExperienceLevel, Integer> DELOAD_FREQUENCY = new EnumMap<>(ExperienceLevel.class);
    private static final Map<ExperienceLevel, VolumeRange> VOLUME_LIMITS = new EnumMap<>(ExperienceLevel.class);
    private static final Map<ProgramGoal, double[]> INTENSITY_RANGES = new EnumMap<>(ProgramGoal.class);

    static {
        DELOAD_FREQUENCY.put(ExperienceLevel.BEGINNER, 6);
        DELOAD_FREQUENCY.put(ExperienceLevel.INTERMEDIATE, 4);
        DELOAD_FREQUENCY.put(ExperienceLevel.ADVANCED, 3);
        DELOAD_FREQUENCY.put(ExperienceLevel.ELITE, 2);

        VOLUME_LIMITS.put(ExperienceLevel.BEGINNER, new VolumeRange(8, 12));
        VOLUME_LIMITS.put(ExperienceLevel.INTERMEDIATE, new VolumeRange(12, 18));
        VOLUME_LIMITS.put(ExperienceLevel.ADVANCED, new VolumeRange(16, 25));
        VOLUME_LIMITS.put(ExperienceLevel.ELITE, new VolumeRange(16, 25));

        INTENSITY_RANGES.put(ProgramGoal.STRENGTH, new double[]{0.75, 0.95});
        INTENSITY_RANGES.put(ProgramGoal.HYPERTROPHY, new double[]{0.65, 0.85});
        INTENSITY_RANGES.put(ProgramGoal.ENDURANCE, new double[]{0.50, 0.70});
        INTENSITY_RANGES.put(ProgramGoal.WEIGHT_LOSS, new double[]{0.55, 0.75});
        INTENSITY_RANGES.put(ProgramGoal.GENERAL_FITNESS, new double[]{0.60, 0.80});
        INTENSITY_RANGES.put(ProgramGoal.SPORT_SPECIFIC, new double[]{0.65, 0.90});
    }

    public PeriodizationModel selectPeriodizationModel(ProgramGoal goal, ExperienceLevel experience, int durationWeeks) {
        ExperienceLevel level = orDefault(experience);
        switch (goal) {
            case STRENGTH:
                if (level == ExperienceLevel.ADVANCED || level == ExperienceLevel.ELITE) {
                    return PeriodizationModel.CONJUGATE;
                }
                return durationWeeks >= 8 ? PeriodizationModel.BLOCK : PeriodizationModel.LINEAR;
            case HYPERTROPHY:
                return level == ExperienceLevel.BEGINNER ? PeriodizationModel.LINEAR : PeriodizationModel.UNDULATING;
            case ENDURANCE:
                return PeriodizationModel.REVERSE_LINEAR;
            case SPORT_SPECIFIC:
                return durationWeeks >= 12 ? PeriodizationModel.BLOCK : PeriodizationModel.UNDULATING;
            case WEIGHT_LOSS:
            case GENERAL_FITNESS:
            default:
                return PeriodizationModel.LINEAR;
        }
    }

    /**
     * One entry per week, numbered 1..durationWeeks. A null model is
     * auto-selected and a null level plans like intermediate.
     */
    public List<WeekParameters> planProgression(int durationWeeks, ProgramGoal goal, ExperienceLevel experience,
                                                PeriodizationModel model) {
        if (durationWeeks < 1) {
            throw new IllegalArgumentException("Duration must be at least 1 week, got " + durationWeeks);
        }
        ExperienceLevel level = orDefault(experience);
        PeriodizationModel chosen = model == null ? selectPeriodizationModel(goal, level, durationWeeks) : model;

        TreeSet<Integer> deloads = new TreeSet<>(calculateDeloadWeeks(durationWeeks, level, chosen));
        List<WeekParameters> weeks = new ArrayList<>(durationWeeks);
        for (int week = 1; week <= durationWeeks; week++) {
            weeks.add(weekParameters(week, durationWeeks, chosen, goal, week, deloads.contains(week)));
        }
        return weeks;
    }

    /** Parameters of a single week; {@code session} drives the undulating and conjugate rotation. */
    public WeekParameters getWeekParameters(int week, int totalWeeks, PeriodizationModel model, ProgramGoal goal,
                                            ExperienceLevel experience, int session) {
        checkWeek(week, totalWeeks);
        boolean deload = calculateDeloadWeeks(totalWeeks, orDefault(experience), model).contains(week);
        return weekParameters(week, totalWeeks, model, goal, session, deload);
    }

    public List<Integer> calculateDeloadWeeks(int durationWeeks, ExperienceLevel experience, PeriodizationModel model) {
        TreeSet<Integer> deloads = new TreeSet<>();
        if (model == PeriodizationModel.BLOCK) {
            int accumEnd = (int) (durationWeeks * 0.4);
            int transEnd = (int) (durationWeeks * 0.8);
            if (accumEnd > 0) deloads.add(accumEnd);
            if (transEnd > 0 && transEnd != accumEnd) deloads.add(transEnd);
            // realization is for peaking, so no final-week deload
        } else {
            int frequency = DELOAD_FREQUENCY.get(orDefault(experience));
            for (int week = frequency; week <= durationWeeks; week += frequency) {
                deloads.add(week);
            }
            if (durationWeeks >= 6) deloads.add(durationWeeks);
        }
        return new ArrayList<>(deloads);
    }

    public VolumeRange getVolumeLimits(ExperienceLevel experience) {
        return VOLUME_LIMITS.get(orDefault(experience));
    }

    /** Linear-model intensity for a week, scaled into the goal range. */
    public double getIntensityTarget(int weekNumber, int totalWeeks, ProgramGoal goal) {
        checkWeek(weekNumber, totalWeeks);
        return round3(scaleToGoal(linear(weekNumber, totalWeeks)[0], goal));
    }

    private WeekParameters weekParameters(int week, int totalWeeks, PeriodizationModel model, ProgramGoal goal,
                                          int session, boolean deload) {
        BlockPhase phase = null;
        EffortType effort = null;
        double[] raw;
        switch (model) {
            case UNDULATING:
                raw = undulating(week, session);
                break;
            case BLOCK:
                phase = blockPhase(week, totalWeeks);
                raw = block(week, totalWeeks, phase);
                break;
            case CONJUGATE:
                effort = conjugateEffort(session);
                raw = conjugate(week, effort);
                break;
            case REVERSE_LINEAR:
                raw = reverseLinear(week, totalWeeks);
                break;
            case LINEAR:
            default:
                raw = linear(week, totalWeeks);
        }

        double intensity = scaleToGoal(raw[0], goal);
        double volume = raw[1];
        if (deload) {
            intensity *= DELOAD_INTENSITY_FACTOR;
            volume *= DELOAD_VOLUME_FACTOR;
        }
        TrainingFocus focus = WeekParameters.determineFocus(intensity, deload, effort);
        String notes = weekNotes(week, totalWeeks, deload, phase, effort);
        return new WeekParameters(week, round3(intensity), round3(volume), deload, phase, effort, focus, notes);
    }

    // --- model curves, each returning {rawIntensity, volumeModifier} ---

    double[] linear(int week, int totalWeeks) {
        double progress = progress(week, totalWeeks);
        return new double[]{0.65 + 0.30 * progress, 1.0 - 0.30 * progress};
    }

    double[] reverseLinear(int week, int totalWeeks) {
        double progress = progress(week, totalWeeks);
        return new double[]{0.90 - 0.30 * progress, 0.7 + 0.60 * progress};
    }

    double[] undulating(int week, int session) {
        double intensity;
        double volume;
        switch ((session - 1) % 3) {
            case 0: intensity = 0.85; volume = 0.8; break;  // heavy
            case 1: intensity = 0.65; volume = 1.2; break;  // light
            default: intensity = 0.75; volume = 1.0;        // moderate
        }
        double weeklyBonus = Math.min(0.02 * (week - 1), 0.10);
        return new double[]{Math.min(intensity + weeklyBonus, 0.95), volume};
    }

    BlockPhase blockPhase(int week, int totalWeeks) {
        int accumEnd = (int) (totalWeeks * 0.4);
        int transEnd = (int) (totalWeeks * 0.8);
        if (week <= accumEnd) return BlockPhase.ACCUMULATION;
        if (week <= transEnd) return BlockPhase.TRANSMUTATION;
        return BlockPhase.REALIZATION;
    }

    double[] block(int week, int totalWeeks, BlockPhase phase) {
        int accumEnd = (int) (totalWeeks * 0.4);
        int transEnd = (int) (totalWeeks * 0.8);
        switch (phase) {
            case ACCUMULATION: {
                double p = phaseProgress(week, 1, accumEnd);
                return new double[]{0.65 + 0.05 * p, 1.2 - 0.1 * p};
            }
            case TRANSMUTATION: {
                double p = phaseProgress(week, accumEnd + 1, transEnd - accumEnd);
                return new double[]{0.75 + 0.10 * p, 1.0 - 0.15 * p};
            }
            default: {
                double p = phaseProgress(week, transEnd + 1, totalWeeks - transEnd);
                return new double[]{0.88 + 0.07 * p, 0.75 - 0.15 * p};
            }
        }
    }

    EffortType conjugateEffort(int session) {
        switch ((session - 1) % 4) {
            case 1: return EffortType.DYNAMIC_EFFORT;
            case 2: return EffortType.REPETITION_EFFORT;
            default: return EffortType.MAX_EFFORT;
        }
    }

    double[] conjugate(int week, EffortType effort) {
        double intensity;
        double volume;
        switch (effort) {
            case DYNAMIC_EFFORT: intensity = 0.55; volume = 1.3; break;
            case REPETITION_EFFORT: intensity = 0.70; volume = 1.1; break;
            default: intensity = 0.92; volume = 0.6;
        }
        double[] wave = {-0.03, 0.0, 0.03};
        intensity = Math.min(Math.max(intensity + wave[(week - 1) % 3], 0.50), 0.98);
        return new double[]{intensity, volume};
    }

    private static double scaleToGoal(double rawIntensity, ProgramGoal goal) {
        double[] range = INTENSITY_RANGES.get(goal);
        double normalized = Math.min(Math.max((rawIntensity - 0.50) / 0.50, 0.0), 1.0);
        return range[0] + normalized * (range[1] - range[0]);
    }

    private static String weekNotes(int week, int totalWeeks, boolean deload, BlockPhase phase, EffortType effort) {
        if (deload) return "Deload week - reduce weights and focus on recovery";
        if (phase == BlockPhase.ACCUMULATION) return "Accumulation phase - focus on volume and technique";
        if (phase == BlockPhase.TRANSMUTATION) return "Transmutation phase - increase intensity, maintain technique";
        if (phase == BlockPhase.REALIZATION) return "Realization phase - peak performance, test maxes";
        if (effort == EffortType.MAX_EFFORT) return "Max effort day - work up to heavy singles/triples";
        if (effort == EffortType.DYNAMIC_EFFORT) return "Dynamic effort - focus on speed and explosiveness";
        if (effort == EffortType.REPETITION_EFFORT) return "Repetition effort - hypertrophy focus with controlled tempo";
        if (week == 1) return "Program start - establish baseline weights";
        if (week == totalWeeks) return "Final week - test progress and reassess goals";
        return null;
    }

    private static double progress(int week, int totalWeeks) {
        return (week - 1) / (double) Math.max(totalWeeks - 1, 1);
    }

    private static double phaseProgress(int week, int phaseStart, int phaseWeeks) {
        if (phaseWeeks <= 1) return 0.0;
        return (week - phaseStart) / (double) (phaseWeeks - 1);
    }

    private static void checkWeek(int week, int totalWeeks) {
        if (totalWeeks < 1) throw new IllegalArgumentException("Total weeks must be at least 1, got " + totalWeeks);
        if (week < 1 || week > totalWeeks) {
            throw new IllegalArgumentException("Week " + week + " out of range [1, " + totalWeeks + "]");
        }
    }

    private static ExperienceLevel orDefault(ExperienceLevel experience) {
        return experience == null ? ExperienceLevel.INTERMEDIATE : experience;
    }

    private static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
