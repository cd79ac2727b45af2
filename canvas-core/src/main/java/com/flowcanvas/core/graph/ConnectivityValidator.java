package com.flowcanvas.core.graph;

import com.flowcanvas.core.exception.CycleDetectedException;
import com.flowcanvas.core.exception.DuplicateConnectionException;
import com.flowcanvas.core.exception.NotFoundException;
import com.flowcanvas.core.exception.PortTypeMismatchException;
import com.flowcanvas.core.exception.SelfConnectionException;
import com.flowcanvas.core.model.Connection;
import com.flowcanvas.core.model.Node;
import com.flowcanvas.core.model.NodeId;
import com.flowcanvas.core.model.PortName;
import com.flowcanvas.core.model.PortType;
import com.flowcanvas.core.model.Workflow;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Gatekeeper for connection creation. Sole enforcer of the acyclic-graph invariant.
 *
 * Checks, in order, first failure wins:
 * 1. self connection
 * 2. both endpoints exist
 * 3. cycle: the target already reaches the source
 * 4. duplicate route (ports included)
 * 5. port-type compatibility, advisory unless strict
 *
 * Reads the workflow only; inserting the connection is the caller's job.
 */
public final class ConnectivityValidator {

    private ConnectivityValidator() {
    }

    /**
     * Run the lenient gate.
     *
     * @return a type warning if the declared port types are incompatible, empty otherwise
     * @throws SelfConnectionException if source equals target
     * @throws NotFoundException if an endpoint is not in the workflow
     * @throws CycleDetectedException if the connection would close a cycle
     * @throws DuplicateConnectionException if the exact route already exists
     */
    public static Optional<String> check(
            Workflow workflow,
            NodeId source,
            NodeId target,
            PortName sourcePort,
            PortName targetPort) {
        if (source.equals(target)) {
            throw new SelfConnectionException(source);
        }

        Node sourceNode = workflow.findNode(source)
            .orElseThrow(() -> new NotFoundException("Node", source.toString()));
        Node targetNode = workflow.findNode(target)
            .orElseThrow(() -> new NotFoundException("Node", target.toString()));

        if (pathExists(workflow.connections(), target, source)) {
            throw new CycleDetectedException(source, target);
        }

        boolean duplicate = workflow.connections().stream()
            .anyMatch(c -> c.hasRoute(source, target, sourcePort, targetPort));
        if (duplicate) {
            throw new DuplicateConnectionException(source, target, sourcePort, targetPort);
        }

        return typeWarning(sourceNode, targetNode);
    }

    /**
     * Run the strict gate: as {@link #check} but a resolved type mismatch is a failure.
     *
     * @throws PortTypeMismatchException if both port types resolve and are incompatible
     */
    public static void checkStrict(
            Workflow workflow,
            NodeId source,
            NodeId target,
            PortName sourcePort,
            PortName targetPort) {
        Optional<String> warning = check(workflow, source, target, sourcePort, targetPort);
        if (warning.isPresent()) {
            Node sourceNode = workflow.findNode(source).orElseThrow();
            Node targetNode = workflow.findNode(target).orElseThrow();
            throw new PortTypeMismatchException(
                source,
                target,
                sourceNode.type().outputType().orElseThrow(),
                targetNode.type().inputType().orElseThrow()
            );
        }
    }

    /**
     * Advisory compatibility of the source's output type with the target's input type.
     * Empty when either side does not resolve (unknown node type) or the types are compatible.
     */
    public static Optional<String> typeWarning(Node sourceNode, Node targetNode) {
        Optional<PortType> output = sourceNode.type().outputType();
        Optional<PortType> input = targetNode.type().inputType();
        if (output.isEmpty() || input.isEmpty()) {
            return Optional.empty();
        }
        if (output.get().canFeed(input.get())) {
            return Optional.empty();
        }
        return Optional.of(PortTypeMismatchException.describe(output.get(), input.get()));
    }

    /**
     * Iterative depth-first reachability over connections in their forward direction.
     * The visited set guarantees termination on graphs with shared ancestors.
     */
    public static boolean pathExists(List<Connection> connections, NodeId from, NodeId to) {
        Set<NodeId> visited = new HashSet<>();
        Deque<NodeId> stack = new ArrayDeque<>();
        stack.push(from);

        while (!stack.isEmpty()) {
            NodeId current = stack.pop();
            if (current.equals(to)) {
                return true;
            }
            if (visited.add(current)) {
                for (Connection connection : connections) {
                    if (connection.source().equals(current)) {
                        stack.push(connection.target());
                    }
                }
            }
        }
        return false;
    }
}
