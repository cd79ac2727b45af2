package com.flowcanvas.core.validation;

public enum ValidationSeverity {
    /**
     * The workflow cannot run as drawn.
     */
    ERROR,

    /**
     * Suspicious but runnable.
     */
    WARNING
}
