package com.tuorg.programservice.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProgramStatus {
    DRAFT("draft"),
    ACTIVE("active"),
    COMPLETED("completed"),
    ARCHIVED("archived");

    private final String value;

    ProgramStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
