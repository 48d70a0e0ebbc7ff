package com.tuorg.programservice.service.llm;

import com.tuorg.programservice.model.Exercise;
import com.tuorg.programservice.model.ExperienceLevel;
import com.tuorg.programservice.model.ProgramGoal;
import com.tuorg.programservice.model.SlotRequirements;
import com.tuorg.programservice.service.PlaceholderIdGenerator;

import java.util.ArrayList;
import java.util.List;

/** Everything a strategy needs to pick the exercises of one workout. */
public class ExerciseSelectionRequest {

    private String workoutType;
    private List<String> muscleGroups = new ArrayList<>();
    private List<String> equipment = new ArrayList<>();
    private int exerciseCount;
    private double intensityPercent;
    private double volumeModifier = 1.0;
    private List<Exercise> availableExercises = new ArrayList<>();
    private List<String> userLimitations = new ArrayList<>();
    private List<String> focusAreas = new ArrayList<>();
    private String preferences;
    private ExperienceLevel experienceLevel;
    private ProgramGoal goal;
    private boolean deload;
    // explicit template slots, filled first by the deterministic strategy
    private List<SlotRequirements> slots = new ArrayList<>();
    private PlaceholderIdGenerator placeholderIds = new PlaceholderIdGenerator();

    public String getWorkoutType() { return workoutType; }
    public void setWorkoutType(String workoutType) { this.workoutType = workoutType; }

    public List<String> getMuscleGroups() { return muscleGroups; }
    public void setMuscleGroups(List<String> muscleGroups) {
        this.muscleGroups = muscleGroups == null ? new ArrayList<>() : new ArrayList<>(muscleGroups);
    }

    public List<String> getEquipment() { return equipment; }
    public void setEquipment(List<String> equipment) {
        this.equipment = equipment == null ? new ArrayList<>() : new ArrayList<>(equipment);
    }

    public int getExerciseCount() { return exerciseCount; }
    public void setExerciseCount(int exerciseCount) { this.exerciseCount = exerciseCount; }

    public double getIntensityPercent() { return intensityPercent; }
    public void setIntensityPercent(double intensityPercent) { this.intensityPercent = intensityPercent; }

    public double getVolumeModifier() { return volumeModifier; }
    public void setVolumeModifier(double volumeModifier) { this.volumeModifier = volumeModifier; }

    public List<Exercise> getAvailableExercises() { return availableExercises; }
    public void setAvailableExercises(List<Exercise> availableExercises) {
        this.availableExercises = availableExercises == null ? new ArrayList<>() : new ArrayList<>(availableExercises);
    }

    public List<String> getUserLimitations() { return userLimitations; }
    public void setUserLimitations(List<String> userLimitations) {
        this.userLimitations = userLimitations == null ? new ArrayList<>() : new ArrayList<>(userLimitations);
    }

    /** Muscle groups the user wants emphasised across the program. */
    public List<String> getFocusAreas() { return focusAreas; }
    public void setFocusAreas(List<String> focusAreas) {
        this.focusAreas = focusAreas == null ? new ArrayList<>() : new ArrayList<>(focusAreas);
    }

    public String getPreferences() { return preferences; }
    public void setPreferences(String preferences) { this.preferences = preferences; }

    public ExperienceLevel getExperienceLevel() { return experienceLevel; }
    public void setExperienceLevel(ExperienceLevel experienceLevel) { this.experienceLevel = experienceLevel; }

    public ProgramGoal getGoal() { return goal; }
    public void setGoal(ProgramGoal goal) { this.goal = goal; }

    public boolean isDeload() { return deload; }
    public void setDeload(boolean deload) { this.deload = deload; }

    public List<SlotRequirements> getSlots() { return slots; }
    public void setSlots(List<SlotRequirements> slots) {
        this.slots = slots == null ? new ArrayList<>() : new ArrayList<>(slots);
    }

    public PlaceholderIdGenerator getPlaceholderIds() { return placeholderIds; }
    public void setPlaceholderIds(PlaceholderIdGenerator placeholderIds) { this.placeholderIds = placeholderIds; }
}
