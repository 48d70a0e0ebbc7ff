package com.tuorg.programservice.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PeriodizationModel {
    LINEAR("linear"),
    UNDULATING("undulating"),
    BLOCK("block"),
    CONJUGATE("conjugate"),
    REVERSE_LINEAR("reverse_linear");

    private final String value;

    PeriodizationModel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
