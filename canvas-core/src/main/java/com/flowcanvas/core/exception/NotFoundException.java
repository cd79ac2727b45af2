package com.flowcanvas.core.exception;

/**
 * Thrown when a workflow, node or connection is not found.
 */
public class NotFoundException extends CanvasException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
