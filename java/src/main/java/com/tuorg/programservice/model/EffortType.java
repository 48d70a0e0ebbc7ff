package com.tuorg.programservice.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Conjugate method effort types. */
public enum EffortType {
    MAX_EFFORT("max_effort"),
    DYNAMIC_EFFORT("dynamic_effort"),
    REPETITION_EFFORT("repetition_effort");

    private final String value;

    EffortType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
