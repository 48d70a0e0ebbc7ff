package com.tuorg.programservice.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ExperienceLevel {
    BEGINNER("beginner"),
    INTERMEDIATE("intermediate"),
    ADVANCED("advanced"),
    ELITE("elite");

    private final String value;

    ExperienceLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Lenient lookup. Blank or unrecognised levels resolve to INTERMEDIATE so
     * downstream lookups (deload cadence, volume limits) always have an entry.
     */
    @JsonCreator
    public static ExperienceLevel fromValue(String raw) {
        if (raw == null || raw.isBlank()) return INTERMEDIATE;
        String key = raw.trim().toLowerCase(Locale.ROOT);
        switch (key) {
            case "beginner":
            case "novice":
                return BEGINNER;
            case "intermediate":
                return INTERMEDIATE;
            case "advanced":
                return ADVANCED;
            case "elite":
            case "expert":
            case "pro":
                return ELITE;
            default:
                return INTERMEDIATE;
        }
    }
}
