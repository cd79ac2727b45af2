package com.flowcanvas.core.exception;

import com.flowcanvas.core.model.NodeId;

/**
 * Thrown when a new connection would close a cycle, i.e. the target
 * already has a path back to the source.
 */
public class CycleDetectedException extends ConnectionException {

    public static final String ERROR_CODE = "WOULD_CREATE_CYCLE";

    public CycleDetectedException(NodeId source, NodeId target) {
        super(ERROR_CODE, String.format(
            "Connection %s -> %s would create a cycle",
            source, target
        ), source, target);
    }
}
