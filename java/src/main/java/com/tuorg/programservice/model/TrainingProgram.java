package com.tuorg.programservice.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class TrainingProgram {

    private String id;
    private String userId;
    private String name;
    private String description;
    private ProgramGoal goal;
    private PeriodizationModel periodizationModel;
    private int durationWeeks;
    private int sessionsPerWeek;
    private ExperienceLevel experienceLevel;
    private List<String> equipmentAvailable = new ArrayList<>();
    private ProgramStatus status = ProgramStatus.DRAFT;
    private Instant createdAt;
    private List<ProgramWeek> weeks = new ArrayList<>();

    /** Copy of the program row and, when {@code withWeeks}, its nested weeks. */
    public TrainingProgram copy(boolean withWeeks) {
        TrainingProgram p = new TrainingProgram();
        p.id = id;
        p.userId = userId;
        p.name = name;
        p.description = description;
        p.goal = goal;
        p.periodizationModel = periodizationModel;
        p.durationWeeks = durationWeeks;
        p.sessionsPerWeek = sessionsPerWeek;
        p.experienceLevel = experienceLevel;
        p.equipmentAvailable = new ArrayList<>(equipmentAvailable);
        p.status = status;
        p.createdAt = createdAt;
        if (withWeeks) {
            for (ProgramWeek w : weeks) p.weeks.add(w.copy());
        }
        return p;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public ProgramGoal getGoal() { return goal; }
    public void setGoal(ProgramGoal goal) { this.goal = goal; }

    public PeriodizationModel getPeriodizationModel() { return periodizationModel; }
    public void setPeriodizationModel(PeriodizationModel periodizationModel) { this.periodizationModel = periodizationModel; }

    public int getDurationWeeks() { return durationWeeks; }
    public void setDurationWeeks(int durationWeeks) { this.durationWeeks = durationWeeks; }

    public int getSessionsPerWeek() { return sessionsPerWeek; }
    public void setSessionsPerWeek(int sessionsPerWeek) { this.sessionsPerWeek = sessionsPerWeek; }

    public ExperienceLevel getExperienceLevel() { return experienceLevel; }
    public void setExperienceLevel(ExperienceLevel experienceLevel) { this.experienceLevel = experienceLevel; }

    public List<String> getEquipmentAvailable() { return equipmentAvailable; }
    public void setEquipmentAvailable(List<String> equipmentAvailable) {
        this.equipmentAvailable = equipmentAvailable == null ? new ArrayList<>() : equipmentAvailable;
    }

    public ProgramStatus getStatus() { return status; }
    public void setStatus(ProgramStatus status) { this.status = status; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public List<ProgramWeek> getWeeks() { return weeks; }
    public void setWeeks(List<ProgramWeek> weeks) {
        this.weeks = weeks == null ? new ArrayList<>() : weeks;
    }
}
