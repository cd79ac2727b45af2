package com.flowcanvas.core.exception;

import com.flowcanvas.core.model.NodeId;
import com.flowcanvas.core.model.PortName;

/**
 * Thrown when an identical (source, target, sourcePort, targetPort) connection already exists.
 */
public class DuplicateConnectionException extends ConnectionException {

    public static final String ERROR_CODE = "DUPLICATE_CONNECTION";

    public DuplicateConnectionException(NodeId source, NodeId target, PortName sourcePort, PortName targetPort) {
        super(ERROR_CODE, String.format(
            "Connection %s:%s -> %s:%s already exists",
            source, sourcePort, target, targetPort
        ), source, target);
    }
}
