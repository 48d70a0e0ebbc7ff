package com.tuorg.programservice.model;

import java.util.ArrayList;
import java.util.List;

public class ProgramWorkout {

    private String id;
    private String weekId;
    private int dayOfWeek;      // 1 = Monday .. 7 = Sunday
    private String name;
    private String workoutType;
    private int targetDurationMinutes;
    private int sortOrder;
    private String notes;
    private List<ExerciseAssignment> exercises = new ArrayList<>();

    public ProgramWorkout copy() {
        ProgramWorkout w = new ProgramWorkout();
        w.id = id;
        w.weekId = weekId;
        w.dayOfWeek = dayOfWeek;
        w.name = name;
        w.workoutType = workoutType;
        w.targetDurationMinutes = targetDurationMinutes;
        w.sortOrder = sortOrder;
        w.notes = notes;
        for (ExerciseAssignment a : exercises) w.exercises.add(a.copy());
        return w;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getWeekId() { return weekId; }
    public void setWeekId(String weekId) { this.weekId = weekId; }

    public int getDayOfWeek() { return dayOfWeek; }
    public void setDayOfWeek(int dayOfWeek) { this.dayOfWeek = dayOfWeek; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getWorkoutType() { return workoutType; }
    public void setWorkoutType(String workoutType) { this.workoutType = workoutType; }

    public int getTargetDurationMinutes() { return targetDurationMinutes; }
    public void setTargetDurationMinutes(int targetDurationMinutes) { this.targetDurationMinutes = targetDurationMinutes; }

    public int getSortOrder() { return sortOrder; }
    public void setSortOrder(int sortOrder) { this.sortOrder = sortOrder; }

    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }

    public List<ExerciseAssignment> getExercises() { return exercises; }
    public void setExercises(List<ExerciseAssignment> exercises) {
        this.exercises = exercises == null ? new ArrayList<>() : exercises;
    }
}
