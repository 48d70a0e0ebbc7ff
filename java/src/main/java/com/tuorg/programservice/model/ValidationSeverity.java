package com.tuorg.programservice.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ValidationSeverity {
    ERROR("error"),       // blocks persistence
    WARNING("warning"),
    INFO("info");

    private final String value;

    ValidationSeverity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
