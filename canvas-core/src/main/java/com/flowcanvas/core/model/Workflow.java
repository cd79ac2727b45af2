package com.flowcanvas.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowcanvas.core.exception.CanvasException;
import com.flowcanvas.core.exception.PortTypeMismatchException;
import com.flowcanvas.core.geometry.CanvasMath;
import com.flowcanvas.core.geometry.Point;
import com.flowcanvas.core.graph.ConnectivityValidator;
import com.flowcanvas.core.graph.DagLayout;
import com.flowcanvas.core.graph.ExecutionPlanner;
import com.flowcanvas.core.graph.LayoutOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Aggregate root of the canvas: ordered nodes, ordered connections, the viewport and the
 * execution cursor.
 *
 * Node insertion order is significant; it is the deterministic tie-break key for layout.
 * Not thread-safe. One owner mutates a workflow at a time; readers take a {@link #copy()}.
 *
 * Invariants:
 * - node ids are unique
 * - connections reference existing nodes at creation, never a node to itself
 * - the connection graph is acyclic (enforced by {@link ConnectivityValidator})
 * - no two connections share (source, target, sourcePort, targetPort)
 * - node positions are finite
 */
public class Workflow {

    private static final Logger log = LoggerFactory.getLogger(Workflow.class);

    /**
     * Step used to nudge a new node off an occupied spot.
     */
    public static final double PLACEMENT_STEP = 30.0;

    /**
     * Screen point treated as the visible centre by {@link #addNodeAtViewportCenter(String)}.
     */
    public static final Point VIEWPORT_CENTER = new Point(400.0, 300.0);

    private final List<Node> nodes;
    private final List<Connection> connections;
    private Viewport viewport;
    private List<NodeId> executionQueue;
    private int currentStep;

    public Workflow() {
        this(new ArrayList<>(), new ArrayList<>(), Viewport.initial(), new ArrayList<>(), 0);
    }

    private Workflow(List<Node> nodes, List<Connection> connections, Viewport viewport,
                     List<NodeId> executionQueue, int currentStep) {
        this.nodes = nodes;
        this.connections = connections;
        this.viewport = viewport;
        this.executionQueue = executionQueue;
        this.currentStep = currentStep;
    }

    /**
     * Rebuild a workflow from stored parts. Connections are taken as-is, without running the
     * connectivity gate, so a stored document is restored exactly.
     */
    public static Workflow restore(List<Node> nodes, List<Connection> connections, Viewport viewport,
                                   List<NodeId> executionQueue, int currentStep) {
        return new Workflow(
            new ArrayList<>(nodes != null ? nodes : List.of()),
            new ArrayList<>(connections != null ? connections : List.of()),
            viewport != null ? viewport : Viewport.initial(),
            new ArrayList<>(executionQueue != null ? executionQueue : List.of()),
            currentStep
        );
    }

    // ========== Accessors ==========

    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<Connection> connections() {
        return Collections.unmodifiableList(connections);
    }

    public Viewport viewport() {
        return viewport;
    }

    public List<NodeId> executionQueue() {
        return Collections.unmodifiableList(executionQueue);
    }

    public int currentStep() {
        return currentStep;
    }

    public Optional<Node> findNode(NodeId id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }

    /**
     * Top-left corners of all nodes, in insertion order.
     */
    public List<Point> positions() {
        return nodes.stream().map(n -> new Point(n.x(), n.y())).toList();
    }

    // ========== Nodes ==========

    /**
     * Add a node of the given type near (x, y). Never fails: unknown types get the
     * "Unknown Node" metadata, a non-finite coordinate falls back to 0 and the request is
     * clamped to +/-{@value CanvasMath#POSITION_LIMIT}.
     *
     * @return id of the new node
     */
    public NodeId addNode(String nodeType, double x, double y) {
        double requestedX = Double.isFinite(x) ? CanvasMath.clampPosition(x) : 0.0;
        double requestedY = Double.isFinite(y) ? CanvasMath.clampPosition(y) : 0.0;
        Point position = CanvasMath.findSafePosition(positions(), requestedX, requestedY, PLACEMENT_STEP);

        NodeId id = NodeId.random();
        String name = nodeType + " " + (nodes.size() + 1);
        nodes.add(Node.create(id, name, nodeType, position.x(), position.y()));
        return id;
    }

    /**
     * Add a node at the model point currently under {@link #VIEWPORT_CENTER}.
     */
    public NodeId addNodeAtViewportCenter(String nodeType) {
        Point model = viewport.toModel(VIEWPORT_CENTER);
        return addNode(nodeType, model.x(), model.y());
    }

    /**
     * Remove a node and every connection touching it. No-op if absent.
     */
    public void removeNode(NodeId id) {
        boolean removed = nodes.removeIf(n -> n.id().equals(id));
        if (removed) {
            connections.removeIf(c -> c.touches(id));
        }
    }

    /**
     * Apply a drag delta, snapping to the 10-unit grid. No-op if absent or any value is not finite.
     */
    public void updateNodePosition(NodeId id, double dx, double dy) {
        updateNode(id, node -> {
            Point moved = CanvasMath.updateNodePosition(node.x(), node.y(), dx, dy);
            return node.withPosition(moved.x(), moved.y());
        });
    }

    /**
     * Set an absolute position, as computed by layout. Non-finite positions are rejected as a no-op.
     */
    public void placeNode(NodeId id, double x, double y) {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            log.debug("Ignoring non-finite position ({}, {}) for node {}", x, y, id);
            return;
        }
        updateNode(id, node -> node.withPosition(x, y));
    }

    public void updateNodeConfig(NodeId id, JsonNode config) {
        updateNode(id, node -> node.withConfig(config));
    }

    public void selectNode(NodeId id) {
        updateNode(id, node -> node.withSelected(true));
    }

    public void deselectAll() {
        nodes.replaceAll(node -> node.selected() ? node.withSelected(false) : node);
    }

    /**
     * Replace a node with a modified copy. No-op if absent; the change is discarded if it would
     * alter the id or produce a non-finite position.
     */
    public void updateNode(NodeId id, UnaryOperator<Node> change) {
        for (int i = 0; i < nodes.size(); i++) {
            Node current = nodes.get(i);
            if (!current.id().equals(id)) {
                continue;
            }
            Node updated = change.apply(current);
            if (updated == null
                    || !updated.id().equals(id)
                    || !Double.isFinite(updated.x())
                    || !Double.isFinite(updated.y())) {
                log.debug("Rejected update of node {}", id);
                return;
            }
            nodes.set(i, updated);
            return;
        }
    }

    // ========== Connections ==========

    /**
     * Create a connection through the lenient connectivity gate.
     *
     * @return {@link ConnectionResult.Status#CREATED}, or
     *         {@link ConnectionResult.Status#CREATED_WITH_TYPE_WARNING} when the declared port types clash
     * @throws com.flowcanvas.core.exception.ConnectionException if the gate refuses the connection
     * @throws com.flowcanvas.core.exception.NotFoundException if an endpoint does not exist
     */
    public ConnectionResult addConnectionChecked(NodeId source, NodeId target,
                                                 PortName sourcePort, PortName targetPort) {
        Optional<String> warning = ConnectivityValidator.check(this, source, target, sourcePort, targetPort);
        Connection connection = Connection.create(source, target, sourcePort, targetPort);
        connections.add(connection);
        return warning
            .map(message -> ConnectionResult.createdWithTypeWarning(connection, message))
            .orElseGet(() -> ConnectionResult.created(connection));
    }

    /**
     * Create a connection through the strict gate: port-type mismatches are refused.
     *
     * @throws PortTypeMismatchException if the declared port types clash
     */
    public ConnectionResult addConnectionStrict(NodeId source, NodeId target,
                                                PortName sourcePort, PortName targetPort) {
        ConnectivityValidator.checkStrict(this, source, target, sourcePort, targetPort);
        Connection connection = Connection.create(source, target, sourcePort, targetPort);
        connections.add(connection);
        return ConnectionResult.created(connection);
    }

    /**
     * Success-signal variant of {@link #addConnectionChecked}: both success kinds map to true,
     * every refusal to false.
     */
    public boolean addConnection(NodeId source, NodeId target, PortName sourcePort, PortName targetPort) {
        try {
            addConnectionChecked(source, target, sourcePort, targetPort);
            return true;
        } catch (CanvasException e) {
            log.debug("Connection {} -> {} refused: {}", source, target, e.getErrorCode());
            return false;
        }
    }

    /**
     * Remove a connection by id. No-op if absent.
     */
    public void removeConnection(UUID connectionId) {
        connections.removeIf(c -> c.id().equals(connectionId));
    }

    // ========== Viewport ==========

    /**
     * Zoom by a relative delta while keeping the screen point (cx, cy) fixed.
     */
    public void zoom(double delta, double cx, double cy) {
        double oldZoom = viewport.zoom();
        double newZoom = CanvasMath.calculateZoomDelta(delta, oldZoom);
        Point offset = CanvasMath.calculatePanOffset(viewport.x(), viewport.y(), cx, cy, oldZoom, newZoom);
        viewport = new Viewport(offset.x(), offset.y(), newZoom);
    }

    /**
     * Shift the viewport by a screen-space delta. Non-finite deltas are ignored.
     */
    public void pan(double dx, double dy) {
        if (!Double.isFinite(dx) || !Double.isFinite(dy)) {
            return;
        }
        viewport = viewport.withOffset(viewport.x() + dx, viewport.y() + dy);
    }

    /**
     * Fit every node into a viewport of the given size. No-op without nodes or on invalid sizes.
     */
    public void fitView(double viewportWidth, double viewportHeight, double padding) {
        CanvasMath.calculateFitView(positions(), viewportWidth, viewportHeight, padding)
            .ifPresent(fitted -> viewport = fitted);
    }

    public void setViewport(Viewport viewport) {
        this.viewport = Objects.requireNonNull(viewport, "viewport");
    }

    // ========== Layout & execution ==========

    public LayoutOutcome applyLayout() {
        return applyLayout(DagLayout.defaults());
    }

    public LayoutOutcome applyLayout(DagLayout layout) {
        return layout.apply(this);
    }

    /**
     * Compute the execution queue, rewind the step cursor and reset every node's runtime state
     * to {@code pending}.
     *
     * @return the new execution queue
     */
    public List<NodeId> prepareRun() {
        executionQueue = new ArrayList<>(ExecutionPlanner.plan(this));
        currentStep = 0;
        nodes.replaceAll(node -> node.withRuntimeReset("pending"));
        return executionQueue();
    }

    // ========== Snapshots ==========

    /**
     * Deep copy: no node, list or JSON document is shared with this instance.
     */
    public Workflow copy() {
        List<Node> nodeCopies = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            nodeCopies.add(node.copy());
        }
        return new Workflow(
            nodeCopies,
            new ArrayList<>(connections),
            viewport,
            new ArrayList<>(executionQueue),
            currentStep
        );
    }
}
