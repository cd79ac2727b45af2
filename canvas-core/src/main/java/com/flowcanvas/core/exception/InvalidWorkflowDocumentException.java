package com.flowcanvas.core.exception;

/**
 * Thrown when a workflow document cannot be encoded or decoded.
 */
public class InvalidWorkflowDocumentException extends CanvasException {

    public static final String ERROR_CODE = "INVALID_DOCUMENT";

    public InvalidWorkflowDocumentException(String message) {
        super(ERROR_CODE, message);
    }

    public InvalidWorkflowDocumentException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
