package com.tuorg.programservice.model;

import java.util.ArrayList;
import java.util.List;

public class ProgramWeek {

    private String id;
    private String programId;
    private int weekNumber;
    private String focus;
    private int intensityPercentage;
    private double volumeModifier = 1.0;
    private boolean deload;
    private String notes;
    private List<ProgramWorkout> workouts = new ArrayList<>();

    public ProgramWeek copy() {
        ProgramWeek w = new ProgramWeek();
        w.id = id;
        w.programId = programId;
        w.weekNumber = weekNumber;
        w.focus = focus;
        w.intensityPercentage = intensityPercentage;
        w.volumeModifier = volumeModifier;
        w.deload = deload;
        w.notes = notes;
        for (ProgramWorkout workout : workouts) w.workouts.add(workout.copy());
        return w;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getProgramId() { return programId; }
    public void setProgramId(String programId) { this.programId = programId; }

    public int getWeekNumber() { return weekNumber; }
    public void setWeekNumber(int weekNumber) { this.weekNumber = weekNumber; }

    public String getFocus() { return focus; }
    public void setFocus(String focus) { this.focus = focus; }

    public int getIntensityPercentage() { return intensityPercentage; }
    public void setIntensityPercentage(int intensityPercentage) { this.intensityPercentage = intensityPercentage; }

    public double getVolumeModifier() { return volumeModifier; }
    public void setVolumeModifier(double volumeModifier) { this.volumeModifier = volumeModifier; }

    public boolean isDeload() { return deload; }
    public void setDeload(boolean deload) { this.deload = deload; }

    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }

    public List<ProgramWorkout> getWorkouts() { return workouts; }
    public void setWorkouts(List<ProgramWorkout> workouts) {
        this.workouts = workouts == null ? new ArrayList<>() : workouts;
    }
}
