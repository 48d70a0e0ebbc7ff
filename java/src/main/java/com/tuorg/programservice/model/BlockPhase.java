package com.tuorg.programservice.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Block periodization phases. */
public enum BlockPhase {
    ACCUMULATION("accumulation", "Volume Accumulation"),
    TRANSMUTATION("transmutation", "Intensity Transmutation"),
    REALIZATION("realization", "Peak Realization");

    private final String value;
    private final String focusLabel;

    BlockPhase(String value, String focusLabel) {
        this.value = value;
        this.focusLabel = focusLabel;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getFocusLabel() {
        return focusLabel;
    }
}
