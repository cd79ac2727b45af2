package com.flowcanvas.core.exception;

import com.flowcanvas.core.model.NodeId;
import com.flowcanvas.core.model.PortType;

/**
 * Thrown by the strict connection path when the source output type cannot feed the target input type.
 * The lenient path reports the same condition as a warning instead.
 */
public class PortTypeMismatchException extends ConnectionException {

    public static final String ERROR_CODE = "TYPE_MISMATCH";

    private final PortType sourceType;
    private final PortType targetType;

    public PortTypeMismatchException(NodeId source, NodeId target, PortType sourceType, PortType targetType) {
        super(ERROR_CODE, describe(sourceType, targetType), source, target);
        this.sourceType = sourceType;
        this.targetType = targetType;
    }

    public PortType getSourceType() {
        return sourceType;
    }

    public PortType getTargetType() {
        return targetType;
    }

    /**
     * Human readable description of a type mismatch, shared with the lenient warning path.
     */
    public static String describe(PortType sourceType, PortType targetType) {
        return String.format("Output type %s is not compatible with input type %s", sourceType, targetType);
    }
}
