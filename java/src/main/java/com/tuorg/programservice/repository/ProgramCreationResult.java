package com.tuorg.programservice.repository;

import java.util.List;

/** Ids written by one atomic program creation. */
public class ProgramCreationResult {

    private final String programId;
    private final List<String> weekIds;
    private final List<String> workoutIds;

    public ProgramCreationResult(String programId, List<String> weekIds, List<String> workoutIds) {
        this.programId = programId;
        this.weekIds = List.copyOf(weekIds);
        this.workoutIds = List.copyOf(workoutIds);
    }

    public String getProgramId() { return programId; }
    public List<String> getWeekIds() { return weekIds; }
    public List<String> getWorkoutIds() { return workoutIds; }
}
