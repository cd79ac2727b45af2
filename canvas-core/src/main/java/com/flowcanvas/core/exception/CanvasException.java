package com.flowcanvas.core.exception;

/**
 * Base exception for all canvas errors.
 */
public class CanvasException extends RuntimeException {

    private final String errorCode;

    public CanvasException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CanvasException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
