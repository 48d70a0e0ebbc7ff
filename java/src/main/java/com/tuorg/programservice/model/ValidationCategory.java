package com.tuorg.programservice.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ValidationCategory {
    EQUIPMENT("equipment"),
    UNIQUENESS("uniqueness"),
    VOLUME("volume"),
    BALANCE("balance"),
    LIMITATIONS("limitations");

    private final String value;

    ValidationCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
