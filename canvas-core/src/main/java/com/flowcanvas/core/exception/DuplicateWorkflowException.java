package com.flowcanvas.core.exception;

/**
 * Thrown when a workflow is created under a name that is already taken.
 */
public class DuplicateWorkflowException extends CanvasException {

    public static final String ERROR_CODE = "DUPLICATE_WORKFLOW";

    public DuplicateWorkflowException(String workflowName) {
        super(ERROR_CODE, String.format(
            "Workflow '%s' already exists",
            workflowName
        ));
    }
}
