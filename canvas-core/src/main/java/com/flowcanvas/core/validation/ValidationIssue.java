package com.flowcanvas.core.validation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowcanvas.core.model.NodeId;

import java.util.Objects;
import java.util.Optional;

/**
 * One finding of {@link WorkflowValidator}, optionally tied to a node.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationIssue(
    ValidationSeverity severity,
    String message,
    @JsonProperty("node_id") NodeId nodeId
) {
    public ValidationIssue {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
    }

    public static ValidationIssue error(String message) {
        return new ValidationIssue(ValidationSeverity.ERROR, message, null);
    }

    public static ValidationIssue error(String message, NodeId nodeId) {
        return new ValidationIssue(ValidationSeverity.ERROR, message, nodeId);
    }

    public static ValidationIssue warning(String message) {
        return new ValidationIssue(ValidationSeverity.WARNING, message, null);
    }

    public static ValidationIssue warning(String message, NodeId nodeId) {
        return new ValidationIssue(ValidationSeverity.WARNING, message, nodeId);
    }

    public boolean isError() {
        return severity == ValidationSeverity.ERROR;
    }

    public Optional<NodeId> node() {
        return Optional.ofNullable(nodeId);
    }
}
