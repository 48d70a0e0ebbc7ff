package com.tuorg.programservice.service.llm;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.databind.JsonNode;
import com.tuorg.programservice.model.Exercise;

import java.util.ArrayList;
import java.util.List;

/**
 * Selection result. Also the shape the model is asked to answer with, so
 * field names are snake_case and setters accept loosely typed values.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExerciseSelectionResponse {

    private List<SelectedExercise> exercises = new ArrayList<>();
    private String workoutNotes;
    private Integer estimatedDurationMinutes;

    public List<SelectedExercise> getExercises() { return exercises; }
    public void setExercises(List<SelectedExercise> exercises) {
        this.exercises = exercises == null ? new ArrayList<>() : exercises;
    }

    @JsonProperty("workout_notes")
    public String getWorkoutNotes() { return workoutNotes; }
    @JsonProperty("workout_notes")
    public void setWorkoutNotes(String workoutNotes) { this.workoutNotes = workoutNotes; }

    @JsonProperty("estimated_duration_minutes")
    public Integer getEstimatedDurationMinutes() { return estimatedDurationMinutes; }
    @JsonSetter("estimated_duration_minutes")
    public void setEstimatedDurationMinutes(JsonNode node) {
        this.estimatedDurationMinutes = toInteger(node);
    }

    public ExerciseSelectionResponse withEstimatedDuration(Integer minutes) {
        this.estimatedDurationMinutes = minutes;
        return this;
    }

    static Integer toInteger(JsonNode node) {
        if (node == null || node.isNull()) return null;
        try {
            if (node.isNumber()) return node.asInt();
            if (node.isTextual()) {
                String digits = node.asText().replaceAll("[^0-9]", "");
                return digits.isEmpty() ? null : Integer.parseInt(digits);
            }
        } catch (NumberFormatException e) {
            return null;
        }
        return null;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SelectedExercise {
        private String exerciseId;
        private String exerciseName;
        private Integer sets;
        private String reps;
        private Integer restSeconds;
        private String notes;
        private Integer order;
        private String supersetGroup;
        // catalog record or placeholder behind exerciseId; never part of the wire shape
        private Exercise exercise;

        public SelectedExercise() {}

        public static SelectedExercise of(Exercise exercise, int order, int sets, String reps, int restSeconds) {
            SelectedExercise s = new SelectedExercise();
            s.exercise = exercise;
            s.exerciseId = exercise.getId();
            s.exerciseName = exercise.getName();
            s.order = order;
            s.sets = sets;
            s.reps = reps;
            s.restSeconds = restSeconds;
            return s;
        }

        @JsonProperty("exercise_id")
        public String getExerciseId() { return exerciseId; }
        @JsonProperty("exercise_name")
        public String getExerciseName() { return exerciseName; }
        public Integer getSets() { return sets; }
        public String getReps() { return reps; }
        @JsonProperty("rest_seconds")
        public Integer getRestSeconds() { return restSeconds; }
        public String getNotes() { return notes; }
        public Integer getOrder() { return order; }
        @JsonProperty("superset_group")
        public String getSupersetGroup() { return supersetGroup; }

        @JsonIgnore
        public Exercise getExercise() { return exercise; }
        @JsonIgnore
        public void setExercise(Exercise exercise) { this.exercise = exercise; }

        // exercise_id can arrive as a number or a string
        @JsonSetter("exercise_id")
        public void setExerciseId(JsonNode node) {
            if (node == null || node.isNull()) this.exerciseId = null;
            else if (node.isValueNode()) this.exerciseId = node.asText().trim();
            else this.exerciseId = node.toString();
        }

        @JsonProperty("exercise_name")
        public void setExerciseName(String exerciseName) { this.exerciseName = exerciseName; }

        @JsonSetter("sets")
        public void setSets(JsonNode node) { this.sets = toInteger(node); }

        // "8-12", 10 or "AMRAP"
        @JsonSetter("reps")
        public void setReps(JsonNode node) {
            if (node == null || node.isNull()) this.reps = null;
            else if (node.isValueNode()) this.reps = node.asText();
            else this.reps = node.toString();
        }

        @JsonSetter("rest_seconds")
        public void setRestSeconds(JsonNode node) { this.restSeconds = toInteger(node); }

        @JsonProperty("notes")
        public void setNotes(String notes) { this.notes = notes; }

        @JsonSetter("order")
        public void setOrder(JsonNode node) { this.order = toInteger(node); }

        @JsonSetter("superset_group")
        public void setSupersetGroup(JsonNode node) {
            this.supersetGroup = node == null || node.isNull() ? null : node.asText();
        }

        /** Overwrites the prescription after the answer has been checked. */
        public void prescribe(int order, int sets, String reps, int restSeconds) {
            this.order = order;
            this.sets = sets;
            this.reps = reps;
            this.restSeconds = restSeconds;
        }
    }
}
