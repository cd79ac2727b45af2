package com.flowcanvas.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;
import java.util.UUID;

/**
 * Directed edge between two node ports.
 *
 * Invariants:
 * - source != target
 * - (source, target, sourcePort, targetPort) is unique within a workflow
 */
public record Connection(
    UUID id,
    NodeId source,
    NodeId target,
    @JsonProperty("source_port") PortName sourcePort,
    @JsonProperty("target_port") PortName targetPort
) {
    public Connection {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(sourcePort, "sourcePort");
        Objects.requireNonNull(targetPort, "targetPort");
    }

    /**
     * Create a new connection with a fresh id.
     */
    public static Connection create(NodeId source, NodeId target, PortName sourcePort, PortName targetPort) {
        return new Connection(UUID.randomUUID(), source, target, sourcePort, targetPort);
    }

    /**
     * Check if either endpoint is the given node.
     */
    public boolean touches(NodeId nodeId) {
        return source.equals(nodeId) || target.equals(nodeId);
    }

    /**
     * Check if this connection has exactly the given route, ports included.
     */
    public boolean hasRoute(NodeId otherSource, NodeId otherTarget, PortName otherSourcePort, PortName otherTargetPort) {
        return source.equals(otherSource)
            && target.equals(otherTarget)
            && sourcePort.equals(otherSourcePort)
            && targetPort.equals(otherTargetPort);
    }
}
