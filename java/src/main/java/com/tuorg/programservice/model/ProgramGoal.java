package com.tuorg.programservice.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ProgramGoal {
    STRENGTH("strength"),
    HYPERTROPHY("hypertrophy"),
    ENDURANCE("endurance"),
    WEIGHT_LOSS("weight_loss"),
    GENERAL_FITNESS("general_fitness"),
    SPORT_SPECIFIC("sport_specific");

    private final String value;

    ProgramGoal(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Goals whose default three-day split is push/pull/legs instead of full body. */
    public boolean isStrengthType() {
        return this == STRENGTH || this == HYPERTROPHY;
    }

    @JsonCreator
    public static ProgramGoal fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Goal is required");
        }
        String key = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (ProgramGoal g : values()) {
            if (g.value.equals(key)) return g;
        }
        throw new IllegalArgumentException("Unknown goal: " + raw);
    }
}
