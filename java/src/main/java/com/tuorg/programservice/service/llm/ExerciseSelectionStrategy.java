package com.tuorg.programservice.service.llm;

import com.tuorg.programservice.exception.ExerciseSelectionException;

/** Chooses the exercises of one workout. */
public interface ExerciseSelectionStrategy {

    /**
     * @throws ExerciseSelectionException when no acceptable selection could be made
     */
    ExerciseSelectionResponse selectExercises(ExerciseSelectionRequest request);

    /** False when the strategy is present but not usable, e.g. missing credentials. */
    default boolean isAvailable() {
        return true;
    }
}
