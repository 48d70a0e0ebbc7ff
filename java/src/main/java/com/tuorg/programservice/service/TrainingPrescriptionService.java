package com.tuorg.programservice.service;

import com.tuorg.programservice.model.ProgramGoal;

public interface TrainingPrescriptionService {

    /** Working sets per exercise; deload weeks drop one set, never below two. */
    int recommendedSets(ProgramGoal goal, boolean deload);

    /** Rep range text such as "8-12". */
    String recommendedReps(ProgramGoal goal);

    int recommendedRestSeconds(ProgramGoal goal);

    /**
     * Load guidance for a lift that supports a 1RM, e.g. "~78% of 1RM".
     * @param intensityPercentage week intensity as a whole percentage
     */
    String recommendedLoad(int intensityPercentage);
}
