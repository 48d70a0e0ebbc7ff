package com.tuorg.programservice.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/** One workout of a split: when it happens, what it trains and how many exercise slots it has. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkoutBlueprint {

    private int dayOfWeek = 1;
    private String name;
    private String workoutType = "full_body";
    private List<String> muscleGroups = new ArrayList<>();
    private int exerciseSlots = 5;
    private int targetDurationMinutes = 60;
    // optional; when present each entry is filled in order before the generic fill
    private List<SlotRequirements> slots = new ArrayList<>();

    public WorkoutBlueprint() {}

    public WorkoutBlueprint(int dayOfWeek, String name, String workoutType, List<String> muscleGroups,
                            int exerciseSlots, int targetDurationMinutes) {
        this.dayOfWeek = dayOfWeek;
        this.name = name;
        this.workoutType = workoutType;
        this.muscleGroups = new ArrayList<>(muscleGroups);
        this.exerciseSlots = exerciseSlots;
        this.targetDurationMinutes = targetDurationMinutes;
    }

    public int getDayOfWeek() { return dayOfWeek; }
    public void setDayOfWeek(int dayOfWeek) { this.dayOfWeek = dayOfWeek; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getWorkoutType() { return workoutType; }
    public void setWorkoutType(String workoutType) { this.workoutType = workoutType; }

    public List<String> getMuscleGroups() { return muscleGroups; }
    public void setMuscleGroups(List<String> muscleGroups) {
        this.muscleGroups = muscleGroups == null ? new ArrayList<>() : muscleGroups;
    }

    public int getExerciseSlots() { return exerciseSlots; }
    public void setExerciseSlots(int exerciseSlots) { this.exerciseSlots = exerciseSlots; }

    public int getTargetDurationMinutes() { return targetDurationMinutes; }
    public void setTargetDurationMinutes(int targetDurationMinutes) { this.targetDurationMinutes = targetDurationMinutes; }

    public List<SlotRequirements> getSlots() { return slots; }
    public void setSlots(List<SlotRequirements> slots) {
        this.slots = slots == null ? new ArrayList<>() : slots;
    }

    /** Exercises to select; never fewer than the explicit slots. */
    public int slotCount() {
        return Math.max(exerciseSlots, slots.size());
    }
}
