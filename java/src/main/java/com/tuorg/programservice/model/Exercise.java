package com.tuorg.programservice.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/** Catalog exercise, or a synthesized placeholder when {@code placeholder} is set. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Exercise {

    public static final String COMPOUND = "compound";
    public static final String ISOLATION = "isolation";

    private String id;
    private String name;
    private List<String> primaryMuscles = new ArrayList<>();
    private List<String> secondaryMuscles = new ArrayList<>();
    private List<String> equipment = new ArrayList<>();
    private String category;
    private String movementPattern;
    private boolean supports1rm;
    private boolean placeholder;

    public Exercise() {}

    public Exercise(String id, String name, List<String> primaryMuscles, List<String> equipment,
                    String category, String movementPattern, boolean supports1rm) {
        this.id = id;
        this.name = name;
        this.primaryMuscles = primaryMuscles == null ? new ArrayList<>() : new ArrayList<>(primaryMuscles);
        this.equipment = equipment == null ? new ArrayList<>() : new ArrayList<>(equipment);
        this.category = category;
        this.movementPattern = movementPattern;
        this.supports1rm = supports1rm;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public List<String> getPrimaryMuscles() { return primaryMuscles; }
    public void setPrimaryMuscles(List<String> primaryMuscles) {
        this.primaryMuscles = primaryMuscles == null ? new ArrayList<>() : primaryMuscles;
    }

    public List<String> getSecondaryMuscles() { return secondaryMuscles; }
    public void setSecondaryMuscles(List<String> secondaryMuscles) {
        this.secondaryMuscles = secondaryMuscles == null ? new ArrayList<>() : secondaryMuscles;
    }

    public List<String> getEquipment() { return equipment; }
    public void setEquipment(List<String> equipment) {
        this.equipment = equipment == null ? new ArrayList<>() : equipment;
    }

    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }

    public String getMovementPattern() { return movementPattern; }
    public void setMovementPattern(String movementPattern) { this.movementPattern = movementPattern; }

    public boolean isSupports1rm() { return supports1rm; }
    public void setSupports1rm(boolean supports1rm) { this.supports1rm = supports1rm; }

    public boolean isPlaceholder() { return placeholder; }
    public void setPlaceholder(boolean placeholder) { this.placeholder = placeholder; }

    public boolean isCompound() {
        return COMPOUND.equals(category);
    }

    @Override
    public String toString() {
        return "Exercise{" + id + "}";
    }
}
