package com.flowcanvas.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowcanvas.core.graph.LayoutOutcome;
import com.flowcanvas.core.model.ConnectionResult;
import com.flowcanvas.core.model.NodeId;
import com.flowcanvas.core.model.PortName;
import com.flowcanvas.core.model.Workflow;
import com.flowcanvas.core.validation.ValidationResult;

import java.util.List;
import java.util.UUID;

/**
 * Editing service for named workflows.
 * A workflow is edited through an open session; saving writes it to the repository.
 *
 * Every call taking a workflow name throws
 * {@link com.flowcanvas.core.exception.NotFoundException} if no session is open under that name.
 */
public interface WorkflowEditorService {

    // ========== Sessions ==========

    /**
     * Create an empty workflow and open a session on it.
     *
     * @throws com.flowcanvas.core.exception.DuplicateWorkflowException if the name is open or stored
     */
    Workflow createWorkflow(String name);

    /**
     * Open a session on a stored workflow. Opening an already open workflow returns its current state.
     *
     * @throws com.flowcanvas.core.exception.NotFoundException if nothing is stored under the name
     */
    Workflow openWorkflow(String name);

    /**
     * Snapshot of the current state. Mutating the result does not affect the session.
     */
    Workflow getWorkflow(String name);

    void saveWorkflow(String name);

    /**
     * Close the session, discarding unsaved changes and history.
     */
    void closeWorkflow(String name);

    List<String> openWorkflows();

    List<String> storedWorkflows();

    // ========== Nodes ==========

    /**
     * Add a node; with no position given it is placed at the centre of the visible area.
     *
     * @return id of the new node
     */
    NodeId addNode(String name, AddNodeRequest request);

    void removeNode(String name, NodeId nodeId);

    /**
     * Drag a node by a delta, snapping to the grid.
     */
    void moveNode(String name, NodeId nodeId, double dx, double dy);

    void updateNodeConfig(String name, NodeId nodeId, JsonNode config);

    void selectNode(String name, NodeId nodeId);

    void deselectAll(String name);

    // ========== Connections ==========

    /**
     * Connect two nodes; incompatible port types are accepted with a warning.
     *
     * @throws com.flowcanvas.core.exception.ConnectionException if the connection is refused
     */
    ConnectionResult connect(String name, ConnectRequest request);

    /**
     * Connect two nodes; incompatible port types are refused.
     *
     * @throws com.flowcanvas.core.exception.PortTypeMismatchException on incompatible port types
     */
    ConnectionResult connectStrict(String name, ConnectRequest request);

    void disconnect(String name, UUID connectionId);

    // ========== Layout & viewport ==========

    LayoutOutcome autoLayout(String name);

    void zoom(String name, double delta, double centerX, double centerY);

    void pan(String name, double dx, double dy);

    void fitView(String name, double viewportWidth, double viewportHeight);

    // ========== History ==========

    /**
     * @return true if a step was undone
     */
    boolean undo(String name);

    /**
     * @return true if a step was redone
     */
    boolean redo(String name);

    // ========== Checks & execution ==========

    ValidationResult validate(String name);

    /**
     * Compute the execution queue and reset node runtime state.
     */
    List<NodeId> prepareRun(String name);

    /**
     * Request to add a node. Null coordinates mean "centre of the visible area".
     */
    record AddNodeRequest(
        String nodeType,
        Double x,
        Double y
    ) {
        public static AddNodeRequest at(String nodeType, double x, double y) {
            return new AddNodeRequest(nodeType, x, y);
        }

        public static AddNodeRequest atViewportCenter(String nodeType) {
            return new AddNodeRequest(nodeType, null, null);
        }

        public boolean hasPosition() {
            return x != null && y != null;
        }
    }

    /**
     * Request to connect two node ports. Null ports default to {@code main}.
     */
    record ConnectRequest(
        NodeId source,
        NodeId target,
        PortName sourcePort,
        PortName targetPort
    ) {
        public ConnectRequest {
            sourcePort = sourcePort != null ? sourcePort : PortName.MAIN;
            targetPort = targetPort != null ? targetPort : PortName.MAIN;
        }

        public static ConnectRequest main(NodeId source, NodeId target) {
            return new ConnectRequest(source, target, PortName.MAIN, PortName.MAIN);
        }
    }
}
