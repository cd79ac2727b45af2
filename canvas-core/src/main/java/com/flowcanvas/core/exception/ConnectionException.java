package com.flowcanvas.core.exception;

import com.flowcanvas.core.model.NodeId;

/**
 * Thrown when a connection is refused by the connectivity gate.
 * The workflow is left untouched whenever this is raised.
 */
public abstract class ConnectionException extends CanvasException {

    private final NodeId source;
    private final NodeId target;

    protected ConnectionException(String errorCode, String message, NodeId source, NodeId target) {
        super(errorCode, message);
        this.source = source;
        this.target = target;
    }

    public NodeId getSource() {
        return source;
    }

    public NodeId getTarget() {
        return target;
    }
}
