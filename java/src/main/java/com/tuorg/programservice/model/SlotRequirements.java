package com.tuorg.programservice.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/** What an exercise slot in a workout asks for. Every field is optional. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SlotRequirements {

    private String movementPattern;
    private List<String> targetMuscles = new ArrayList<>();
    private String category;
    private Boolean supports1rm;
    private List<String> preferredEquipment = new ArrayList<>();

    public SlotRequirements() {}

    public SlotRequirements(String movementPattern, List<String> targetMuscles, String category, Boolean supports1rm) {
        this.movementPattern = movementPattern;
        setTargetMuscles(targetMuscles);
        this.category = category;
        this.supports1rm = supports1rm;
    }

    public String getMovementPattern() { return movementPattern; }
    public void setMovementPattern(String movementPattern) { this.movementPattern = movementPattern; }

    public List<String> getTargetMuscles() { return targetMuscles; }
    public void setTargetMuscles(List<String> targetMuscles) {
        this.targetMuscles = targetMuscles == null ? new ArrayList<>() : new ArrayList<>(targetMuscles);
    }

    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }

    public Boolean getSupports1rm() { return supports1rm; }
    public void setSupports1rm(Boolean supports1rm) { this.supports1rm = supports1rm; }

    public List<String> getPreferredEquipment() { return preferredEquipment; }
    public void setPreferredEquipment(List<String> preferredEquipment) {
        this.preferredEquipment = preferredEquipment == null ? new ArrayList<>() : new ArrayList<>(preferredEquipment);
    }

    public SlotRequirements withPreferredEquipment(List<String> equipment) {
        setPreferredEquipment(equipment);
        return this;
    }

    public boolean hasMovementPattern() {
        return movementPattern != null && !movementPattern.isBlank();
    }

    public boolean hasTargetMuscles() {
        return targetMuscles != null && !targetMuscles.isEmpty();
    }
}
