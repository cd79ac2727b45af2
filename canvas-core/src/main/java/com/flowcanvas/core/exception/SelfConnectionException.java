package com.flowcanvas.core.exception;

import com.flowcanvas.core.model.NodeId;

/**
 * Thrown when a node is connected to itself.
 */
public class SelfConnectionException extends ConnectionException {

    public static final String ERROR_CODE = "SELF_CONNECTION";

    public SelfConnectionException(NodeId node) {
        super(ERROR_CODE, String.format("Cannot connect node %s to itself", node), node, node);
    }
}
