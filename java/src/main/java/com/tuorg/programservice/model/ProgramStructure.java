package com.tuorg.programservice.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Split blueprint shared by stored templates and the synthesized default.
 * Week patterns rotate: program week N uses pattern (N - 1) % weeks.size().
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProgramStructure {

    private String splitType;
    private int mesocycleLength = 4;
    private int deloadFrequency = 4;
    private List<WeekBlueprint> weeks = new ArrayList<>();

    public String getSplitType() { return splitType; }
    public void setSplitType(String splitType) { this.splitType = splitType; }

    public int getMesocycleLength() { return mesocycleLength; }
    public void setMesocycleLength(int mesocycleLength) { this.mesocycleLength = mesocycleLength; }

    public int getDeloadFrequency() { return deloadFrequency; }
    public void setDeloadFrequency(int deloadFrequency) { this.deloadFrequency = deloadFrequency; }

    public List<WeekBlueprint> getWeeks() { return weeks; }
    public void setWeeks(List<WeekBlueprint> weeks) {
        this.weeks = weeks == null ? new ArrayList<>() : weeks;
    }

    public List<WorkoutBlueprint> workoutsForWeek(int weekNumber) {
        if (weeks.isEmpty()) return List.of();
        return weeks.get((weekNumber - 1) % weeks.size()).getWorkouts();
    }

    /** Workouts in the first week pattern, or 3 when the structure carries none. */
    public int sessionsPerWeek() {
        if (weeks.isEmpty()) return 3;
        List<WorkoutBlueprint> first = weeks.get(0).getWorkouts();
        return first.isEmpty() ? 3 : first.size();
    }
}
