package com.tuorg.programservice.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ProgramTemplate {

    private String id;
    private String name;
    private ProgramGoal goal;
    private ExperienceLevel experienceLevel;
    private int durationWeeks;
    private ProgramStructure structure = new ProgramStructure();
    private int usageCount;

    public ProgramTemplate() {}

    public ProgramTemplate(ProgramTemplate other) {
        this.id = other.id;
        this.name = other.name;
        this.goal = other.goal;
        this.experienceLevel = other.experienceLevel;
        this.durationWeeks = other.durationWeeks;
        this.structure = other.structure;
        this.usageCount = other.usageCount;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public ProgramGoal getGoal() { return goal; }
    public void setGoal(ProgramGoal goal) { this.goal = goal; }

    public ExperienceLevel getExperienceLevel() { return experienceLevel; }
    public void setExperienceLevel(ExperienceLevel experienceLevel) { this.experienceLevel = experienceLevel; }

    public int getDurationWeeks() { return durationWeeks; }
    public void setDurationWeeks(int durationWeeks) { this.durationWeeks = durationWeeks; }

    public ProgramStructure getStructure() { return structure; }
    public void setStructure(ProgramStructure structure) {
        this.structure = structure == null ? new ProgramStructure() : structure;
    }

    public int getUsageCount() { return usageCount; }
    public void setUsageCount(int usageCount) { this.usageCount = usageCount; }
}
