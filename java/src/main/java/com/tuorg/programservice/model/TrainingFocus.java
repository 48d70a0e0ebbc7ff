package com.tuorg.programservice.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrainingFocus {
    STRENGTH("strength"),
    POWER("power"),
    HYPERTROPHY("hypertrophy"),
    ENDURANCE("endurance"),
    DELOAD("deload");

    private final String value;

    TrainingFocus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
