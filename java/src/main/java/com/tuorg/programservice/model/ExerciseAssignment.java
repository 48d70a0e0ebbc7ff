package com.tuorg.programservice.model;

import java.util.ArrayList;
import java.util.List;

/** An exercise placed in a workout together with its prescription. */
public class ExerciseAssignment {

    private String exerciseId;
    private String exerciseName;
    private int sets;
    private String reps;
    private int restSeconds;
    private int order;
    private String notes;
    private List<String> primaryMuscles = new ArrayList<>();
    private List<String> equipment = new ArrayList<>();
    private boolean placeholder;

    public ExerciseAssignment() {}

    public static ExerciseAssignment of(Exercise exercise, int order, int sets, String reps, int restSeconds) {
        ExerciseAssignment a = new ExerciseAssignment();
        a.exerciseId = exercise.getId();
        a.exerciseName = exercise.getName() == null ? exercise.getId() : exercise.getName();
        a.order = order;
        a.sets = sets;
        a.reps = reps;
        a.restSeconds = restSeconds;
        a.primaryMuscles = new ArrayList<>(exercise.getPrimaryMuscles());
        a.equipment = new ArrayList<>(exercise.getEquipment());
        a.placeholder = exercise.isPlaceholder();
        return a;
    }

    public ExerciseAssignment copy() {
        ExerciseAssignment a = new ExerciseAssignment();
        a.exerciseId = exerciseId;
        a.exerciseName = exerciseName;
        a.sets = sets;
        a.reps = reps;
        a.restSeconds = restSeconds;
        a.order = order;
        a.notes = notes;
        a.primaryMuscles = new ArrayList<>(primaryMuscles);
        a.equipment = new ArrayList<>(equipment);
        a.placeholder = placeholder;
        return a;
    }

    public String getExerciseId() { return exerciseId; }
    public void setExerciseId(String exerciseId) { this.exerciseId = exerciseId; }

    public String getExerciseName() { return exerciseName; }
    public void setExerciseName(String exerciseName) { this.exerciseName = exerciseName; }

    public int getSets() { return sets; }
    public void setSets(int sets) { this.sets = sets; }

    public String getReps() { return reps; }
    public void setReps(String reps) { this.reps = reps; }

    public int getRestSeconds() { return restSeconds; }
    public void setRestSeconds(int restSeconds) { this.restSeconds = restSeconds; }

    public int getOrder() { return order; }
    public void setOrder(int order) { this.order = order; }

    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }

    public List<String> getPrimaryMuscles() { return primaryMuscles; }
    public void setPrimaryMuscles(List<String> primaryMuscles) {
        this.primaryMuscles = primaryMuscles == null ? new ArrayList<>() : primaryMuscles;
    }

    public List<String> getEquipment() { return equipment; }
    public void setEquipment(List<String> equipment) {
        this.equipment = equipment == null ? new ArrayList<>() : equipment;
    }

    public boolean isPlaceholder() { return placeholder; }
    public void setPlaceholder(boolean placeholder) { this.placeholder = placeholder; }
}
