package com.tuorg.programservice.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class WeekBlueprint {

    private int weekPattern = 1;
    private String focus;
    private List<WorkoutBlueprint> workouts = new ArrayList<>();

    public WeekBlueprint() {}

    public WeekBlueprint(int weekPattern, String focus, List<WorkoutBlueprint> workouts) {
        this.weekPattern = weekPattern;
        this.focus = focus;
        this.workouts = new ArrayList<>(workouts);
    }

    public int getWeekPattern() { return weekPattern; }
    public void setWeekPattern(int weekPattern) { this.weekPattern = weekPattern; }

    public String getFocus() { return focus; }
    public void setFocus(String focus) { this.focus = focus; }

    public List<WorkoutBlueprint> getWorkouts() { return workouts; }
    public void setWorkouts(List<WorkoutBlueprint> workouts) {
        this.workouts = workouts == null ? new ArrayList<>() : workouts;
    }
}
