package com.tuorg.programservice.repository;

import com.tuorg.programservice.exception.ProgramCreationException;
import com.tuorg.programservice.model.ProgramWeek;
import com.tuorg.programservice.model.ProgramWorkout;
import com.tuorg.programservice.model.TrainingProgram;

import java.util.List;
import java.util.Optional;

public interface ProgramRepository {

    TrainingProgram create(TrainingProgram program);

    /** Program with its weeks, workouts and exercises. */
    Optional<TrainingProgram> getById(String programId);

    List<TrainingProgram> getByUser(String userId);

    ProgramWeek createWeek(ProgramWeek week);

    ProgramWorkout createWorkout(ProgramWorkout workout);

    /**
     * Writes the program, every week and every workout as one unit. Ids are
     * expected to be assigned by the caller. Either all records become
     * visible or none do.
     *
     * @throws ProgramCreationException when the unit could not be committed
     */
    ProgramCreationResult createProgramAtomic(TrainingProgram program, List<ProgramWeek> weeksWithWorkouts);
}
