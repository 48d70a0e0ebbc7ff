package com.tuorg.programservice.exception;

import com.tuorg.programservice.model.ValidationIssue;
import com.tuorg.programservice.model.ValidationResult;

import java.util.stream.Collectors;

/** The generated program had error-severity issues; nothing was written. */
public class ProgramValidationException extends ProgramGenerationException {

    private final transient ValidationResult result;

    public ProgramValidationException(ValidationResult result) {
        super("Generated program failed validation: " + result.getErrors().stream()
                .map(ValidationIssue::getMessage)
                .collect(Collectors.joining("; ")));
        this.result = result;
    }

    public ValidationResult getResult() {
        return result;
    }
}
