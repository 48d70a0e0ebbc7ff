package com.tuorg.programservice.model;

public class ValidationIssue {

    private final ValidationSeverity severity;
    private final ValidationCategory category;
    private final String message;
    private final String location;
    private final String suggestion;

    public ValidationIssue(ValidationSeverity severity, ValidationCategory category, String message,
                           String location, String suggestion) {
        this.severity = severity;
        this.category = category;
        this.message = message;
        this.location = location;
        this.suggestion = suggestion;
    }

    public ValidationSeverity getSeverity() { return severity; }
    public ValidationCategory getCategory() { return category; }
    public String getMessage() { return message; }
    public String getLocation() { return location; }
    public String getSuggestion() { return suggestion; }

    @Override
    public String toString() {
        return severity.getValue() + "[" + category.getValue() + "] " + message
                + (location == null ? "" : " @ " + location);
    }
}
