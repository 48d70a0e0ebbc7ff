package com.tuorg.programservice.model;

import java.util.List;
import java.util.stream.Collectors;

/** Outcome of a validation pass. Valid iff no issue has ERROR severity. */
public class ValidationResult {

    private final List<ValidationIssue> issues;
    private final String summary;

    public ValidationResult(List<ValidationIssue> issues, String summary) {
        this.issues = List.copyOf(issues);
        this.summary = summary;
    }

    public boolean isValid() {
        return issues.stream().noneMatch(i -> i.getSeverity() == ValidationSeverity.ERROR);
    }

    public List<ValidationIssue> getIssues() { return issues; }
    public String getSummary() { return summary; }

    public List<ValidationIssue> getErrors() {
        return bySeverity(ValidationSeverity.ERROR);
    }

    public List<ValidationIssue> getWarnings() {
        return bySeverity(ValidationSeverity.WARNING);
    }

    public List<ValidationIssue> byCategory(ValidationCategory category) {
        return issues.stream().filter(i -> i.getCategory() == category).collect(Collectors.toList());
    }

    private List<ValidationIssue> bySeverity(ValidationSeverity severity) {
        return issues.stream().filter(i -> i.getSeverity() == severity).collect(Collectors.toList());
    }
}
