package com.tuorg.programservice.repository;

import com.tuorg.programservice.model.Exercise;

import java.util.List;
import java.util.Optional;

public interface ExerciseRepository {

    Optional<Exercise> getById(String exerciseId);

    /**
     * Filtered lookup. Null or empty arguments are not applied. An exercise
     * passes the equipment filter when it needs nothing or shares at least
     * one item with {@code equipment}; callers apply the strict subset rule.
     */
    List<Exercise> search(List<String> muscleGroups, List<String> equipment, String movementPattern,
                          String category, Boolean supports1rm, int limit);

    /** Exercises hitting the muscles of a workout type whose equipment is fully available. */
    List<Exercise> getForWorkoutType(String workoutType, List<String> equipment, int limit);

    /** Same movement pattern as the source, most similar first. Never contains the source. */
    List<Exercise> getSimilarExercises(String exerciseId, int limit);
}
