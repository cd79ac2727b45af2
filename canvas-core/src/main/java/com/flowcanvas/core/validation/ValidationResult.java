package com.flowcanvas.core.validation;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Outcome of a structural validation run. Valid means "no errors"; warnings are allowed.
 */
public record ValidationResult(List<ValidationIssue> issues) {

    public ValidationResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    @JsonIgnore
    public boolean hasErrors() {
        return issues.stream().anyMatch(ValidationIssue::isError);
    }

    @JsonIgnore
    public boolean hasWarnings() {
        return issues.stream().anyMatch(issue -> !issue.isError());
    }

    @JsonIgnore
    public long errorCount() {
        return issues.stream().filter(ValidationIssue::isError).count();
    }

    @JsonIgnore
    public long warningCount() {
        return issues.stream().filter(issue -> !issue.isError()).count();
    }

    @JsonIgnore
    public boolean isValid() {
        return !hasErrors();
    }
}
