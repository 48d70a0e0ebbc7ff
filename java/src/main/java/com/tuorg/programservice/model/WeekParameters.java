package com.tuorg.programservice.model;

/**
 * Periodization parameters for one training week. Computed per generation
 * call and copied onto {@link ProgramWeek}; never persisted on its own.
 */
public class WeekParameters {

    private final int weekNumber;
    private final double intensityPercent;
    private final double volumeModifier;
    private final boolean deload;
    private final BlockPhase phase;
    private final EffortType effortType;
    private final TrainingFocus focus;
    private final String notes;

    public WeekParameters(int weekNumber, double intensityPercent, double volumeModifier, boolean deload,
                          BlockPhase phase, EffortType effortType, TrainingFocus focus, String notes) {
        this.weekNumber = weekNumber;
        this.intensityPercent = intensityPercent;
        this.volumeModifier = volumeModifier;
        this.deload = deload;
        this.phase = phase;
        this.effortType = effortType;
        this.focus = focus;
        this.notes = notes;
    }

    public int getWeekNumber() { return weekNumber; }
    public double getIntensityPercent() { return intensityPercent; }
    public double getVolumeModifier() { return volumeModifier; }
    public boolean isDeload() { return deload; }
    public BlockPhase getPhase() { return phase; }
    public EffortType getEffortType() { return effortType; }
    public TrainingFocus getFocus() { return focus; }
    public String getNotes() { return notes; }

    /** Rep range implied by the week's intensity (e.g. "4-6"). */
    public String getRepRange() {
        double intensity = intensityPercent > 1 ? intensityPercent : intensityPercent * 100;
        if (intensity >= 90) return "1-3";
        if (intensity >= 80) return "4-6";
        if (intensity >= 70) return "6-8";
        return "8-12";
    }

    public static TrainingFocus determineFocus(double intensityPercent, boolean deload, EffortType effortType) {
        if (deload) return TrainingFocus.DELOAD;

        if (effortType == EffortType.MAX_EFFORT) return TrainingFocus.STRENGTH;
        if (effortType == EffortType.DYNAMIC_EFFORT) return TrainingFocus.POWER;
        if (effortType == EffortType.REPETITION_EFFORT) return TrainingFocus.HYPERTROPHY;

        double intensity = intensityPercent > 1 ? intensityPercent : intensityPercent * 100;
        if (intensity >= 85) return TrainingFocus.STRENGTH;
        if (intensity >= 75) return TrainingFocus.POWER;
        if (intensity >= 65) return TrainingFocus.HYPERTROPHY;
        return TrainingFocus.ENDURANCE;
    }

    @Override
    public String toString() {
        return "WeekParameters{week=" + weekNumber + ", intensity=" + intensityPercent
                + ", volume=" + volumeModifier + ", deload=" + deload + ", phase=" + phase + "}";
    }
}
