package com.flowcanvas.engine.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowcanvas.core.exception.CanvasException;
import com.flowcanvas.core.exception.DuplicateWorkflowException;
import com.flowcanvas.core.exception.NotFoundException;
import com.flowcanvas.core.graph.DagLayout;
import com.flowcanvas.core.graph.LayoutOutcome;
import com.flowcanvas.core.model.ConnectionResult;
import com.flowcanvas.core.model.Node;
import com.flowcanvas.core.model.NodeId;
import com.flowcanvas.core.model.Workflow;
import com.flowcanvas.core.repository.WorkflowRepository;
import com.flowcanvas.core.validation.ValidationResult;
import com.flowcanvas.core.validation.WorkflowValidator;
import com.flowcanvas.engine.config.EditorSettings;
import com.flowcanvas.engine.logging.LoggingContext;
import com.flowcanvas.engine.metrics.EditorMetrics;
import com.flowcanvas.engine.service.WorkflowEditorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Editor coordinator: owns the open sessions and routes every edit through the workflow
 * aggregate, the undo history, metrics and logging.
 *
 * Edits are serialized per session; different workflows can be edited concurrently.
 */
public class WorkflowEditorCoordinator implements WorkflowEditorService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEditorCoordinator.class);

    private final WorkflowRepository repository;
    private final DagLayout layout;
    private final EditorMetrics metrics;
    private final EditorSettings settings;

    private final Map<String, EditorSession> sessions = new ConcurrentHashMap<>();

    public WorkflowEditorCoordinator(
            WorkflowRepository repository,
            DagLayout layout,
            EditorMetrics metrics,
            EditorSettings settings) {
        this.repository = repository;
        this.layout = layout;
        this.metrics = metrics;
        this.settings = settings;
    }

    // ========== Sessions ==========

    @Override
    public Workflow createWorkflow(String name) {
        try (var ctx = LoggingContext.forOperation(name, "create")) {
            if (repository.exists(name)) {
                throw new DuplicateWorkflowException(name);
            }
            EditorSession session = new EditorSession(name, new Workflow(), settings.historyCapacity());
            if (sessions.putIfAbsent(name, session) != null) {
                throw new DuplicateWorkflowException(name);
            }
            metrics.sessionOpened();
            log.info("Created workflow: {}", name);
            return session.workflow().copy();
        }
    }

    @Override
    public Workflow openWorkflow(String name) {
        try (var ctx = LoggingContext.forOperation(name, "open")) {
            EditorSession existing = sessions.get(name);
            if (existing != null) {
                log.debug("Workflow already open: {}", name);
                return snapshot(existing);
            }

            Workflow stored = repository.find(name)
                .orElseThrow(() -> new NotFoundException("Workflow", name));
            EditorSession session = new EditorSession(name, stored, settings.historyCapacity());
            EditorSession raced = sessions.putIfAbsent(name, session);
            if (raced != null) {
                return snapshot(raced);
            }
            metrics.sessionOpened();
            log.info("Opened workflow: {} ({} nodes, {} connections)",
                name, stored.nodes().size(), stored.connections().size());
            return stored.copy();
        }
    }

    @Override
    public Workflow getWorkflow(String name) {
        return snapshot(session(name));
    }

    @Override
    public void saveWorkflow(String name) {
        EditorSession session = session(name);
        try (var ctx = LoggingContext.forOperation(name, "save")) {
            synchronized (session) {
                repository.save(name, session.workflow());
                session.markSaved();
            }
            log.info("Saved workflow: {}", name);
        }
    }

    @Override
    public void closeWorkflow(String name) {
        try (var ctx = LoggingContext.forOperation(name, "close")) {
            EditorSession session = sessions.remove(name);
            if (session == null) {
                throw new NotFoundException("Workflow", name);
            }
            metrics.sessionClosed();
            if (session.isDirty()) {
                log.warn("Closed workflow with unsaved changes: {}", name);
            } else {
                log.info("Closed workflow: {}", name);
            }
        }
    }

    @Override
    public List<String> openWorkflows() {
        return sessions.keySet().stream().sorted().toList();
    }

    @Override
    public List<String> storedWorkflows() {
        return repository.listNames();
    }

    // ========== Nodes ==========

    @Override
    public NodeId addNode(String name, AddNodeRequest request) {
        try (var ctx = LoggingContext.forOperation(name, "addNode")) {
            NodeId nodeId = edit(name, workflow -> request.hasPosition()
                ? workflow.addNode(request.nodeType(), request.x(), request.y())
                : workflow.addNodeAtViewportCenter(request.nodeType()), added -> true);
            LoggingContext.setNodeId(nodeId);
            metrics.nodeAdded(request.nodeType());
            log.debug("Added {} node", request.nodeType());
            return nodeId;
        }
    }

    @Override
    public void removeNode(String name, NodeId nodeId) {
        try (var ctx = LoggingContext.forNode(name, nodeId, "removeNode")) {
            boolean removed = edit(name, workflow -> {
                boolean present = workflow.findNode(nodeId).isPresent();
                workflow.removeNode(nodeId);
                return present;
            }, present -> present);
            if (removed) {
                metrics.nodeRemoved();
                log.debug("Removed node");
            }
        }
    }

    @Override
    public void moveNode(String name, NodeId nodeId, double dx, double dy) {
        try (var ctx = LoggingContext.forNode(name, nodeId, "moveNode")) {
            boolean moved = edit(name, workflow -> {
                Optional<Node> before = workflow.findNode(nodeId);
                workflow.updateNodePosition(nodeId, dx, dy);
                return !before.equals(workflow.findNode(nodeId));
            }, changed -> changed);
            if (moved) {
                log.debug("Moved node by ({}, {})", dx, dy);
            }
        }
    }

    @Override
    public void updateNodeConfig(String name, NodeId nodeId, JsonNode config) {
        try (var ctx = LoggingContext.forNode(name, nodeId, "updateNodeConfig")) {
            boolean updated = edit(name, workflow -> {
                Optional<Node> before = workflow.findNode(nodeId);
                workflow.updateNodeConfig(nodeId, config);
                return !before.equals(workflow.findNode(nodeId));
            }, changed -> changed);
            if (updated) {
                log.debug("Updated node config");
            }
        }
    }

    @Override
    public void selectNode(String name, NodeId nodeId) {
        view(name, workflow -> {
            workflow.selectNode(nodeId);
            return null;
        });
    }

    @Override
    public void deselectAll(String name) {
        view(name, workflow -> {
            workflow.deselectAll();
            return null;
        });
    }

    // ========== Connections ==========

    @Override
    public ConnectionResult connect(String name, ConnectRequest request) {
        return connect(name, request, false);
    }

    @Override
    public ConnectionResult connectStrict(String name, ConnectRequest request) {
        return connect(name, request, true);
    }

    private ConnectionResult connect(String name, ConnectRequest request, boolean strict) {
        session(name);
        try (var ctx = LoggingContext.forOperation(name, strict ? "connectStrict" : "connect")) {
            ConnectionResult result;
            try {
                result = edit(name, workflow -> strict
                    ? workflow.addConnectionStrict(
                        request.source(), request.target(), request.sourcePort(), request.targetPort())
                    : workflow.addConnectionChecked(
                        request.source(), request.target(), request.sourcePort(), request.targetPort()),
                    created -> true);
            } catch (CanvasException e) {
                metrics.connectionRejected(e.getErrorCode());
                log.warn("Connection {} -> {} refused [{}]: {}",
                    request.source(), request.target(), e.getErrorCode(), e.getMessage());
                throw e;
            }

            metrics.connectionCreated(result.hasWarning());
            result.warningMessage().ifPresentOrElse(
                warning -> log.info("Connected {} -> {} with type warning: {}",
                    request.source(), request.target(), warning),
                () -> log.debug("Connected {} -> {}", request.source(), request.target()));
            return result;
        }
    }

    @Override
    public void disconnect(String name, UUID connectionId) {
        try (var ctx = LoggingContext.forOperation(name, "disconnect")) {
            boolean removed = edit(name, workflow -> {
                boolean present = workflow.connections().stream().anyMatch(c -> c.id().equals(connectionId));
                workflow.removeConnection(connectionId);
                return present;
            }, present -> present);
            if (removed) {
                log.debug("Removed connection {}", connectionId);
            }
        }
    }

    // ========== Layout & viewport ==========

    @Override
    public LayoutOutcome autoLayout(String name) {
        try (var ctx = LoggingContext.forOperation(name, "autoLayout")) {
            LayoutOutcome outcome = edit(name, workflow -> workflow.applyLayout(layout), LayoutOutcome::isApplied);
            metrics.layoutRun(outcome);
            switch (outcome) {
                case APPLIED -> log.info("Applied auto-layout");
                case SKIPPED_EMPTY -> log.info("Skipped auto-layout: workflow has no nodes");
                case SKIPPED_CYCLIC -> log.warn("Skipped auto-layout: workflow contains a cycle");
            }
            return outcome;
        }
    }

    @Override
    public void zoom(String name, double delta, double centerX, double centerY) {
        view(name, workflow -> {
            workflow.zoom(delta, centerX, centerY);
            return null;
        });
    }

    @Override
    public void pan(String name, double dx, double dy) {
        view(name, workflow -> {
            workflow.pan(dx, dy);
            return null;
        });
    }

    @Override
    public void fitView(String name, double viewportWidth, double viewportHeight) {
        view(name, workflow -> {
            workflow.fitView(viewportWidth, viewportHeight, settings.fitPadding());
            return null;
        });
    }

    // ========== History ==========

    @Override
    public boolean undo(String name) {
        EditorSession session = session(name);
        try (var ctx = LoggingContext.forOperation(name, "undo")) {
            Optional<Workflow> previous;
            synchronized (session) {
                previous = session.history().undo(session.workflow());
                previous.ifPresent(session::replace);
            }
            if (previous.isEmpty()) {
                log.debug("Nothing to undo");
                return false;
            }
            metrics.undoApplied();
            log.debug("Undid last edit");
            return true;
        }
    }

    @Override
    public boolean redo(String name) {
        EditorSession session = session(name);
        try (var ctx = LoggingContext.forOperation(name, "redo")) {
            Optional<Workflow> next;
            synchronized (session) {
                next = session.history().redo(session.workflow());
                next.ifPresent(session::replace);
            }
            if (next.isEmpty()) {
                log.debug("Nothing to redo");
                return false;
            }
            metrics.redoApplied();
            log.debug("Redid last undone edit");
            return true;
        }
    }

    // ========== Checks & execution ==========

    @Override
    public ValidationResult validate(String name) {
        try (var ctx = LoggingContext.forOperation(name, "validate")) {
            ValidationResult result = view(name, WorkflowValidator::validate);
            log.info("Validated workflow: {} errors, {} warnings", result.errorCount(), result.warningCount());
            return result;
        }
    }

    @Override
    public List<NodeId> prepareRun(String name) {
        try (var ctx = LoggingContext.forOperation(name, "prepareRun")) {
            List<NodeId> queue = edit(name, Workflow::prepareRun, prepared -> true);
            log.info("Prepared run with {} steps", queue.size());
            return queue;
        }
    }

    // ========== Helpers ==========

    private EditorSession session(String name) {
        EditorSession session = sessions.get(name);
        if (session == null) {
            throw new NotFoundException("Workflow", name);
        }
        return session;
    }

    private Workflow snapshot(EditorSession session) {
        synchronized (session) {
            return session.workflow().copy();
        }
    }

    /**
     * Run a recorded edit. The pre-edit state becomes an undo point only if the edit succeeds
     * and {@code changed} accepts its result; a no-op leaves history and redo untouched.
     */
    private <T> T edit(String name, Function<Workflow, T> change, Predicate<T> changed) {
        EditorSession session = session(name);
        synchronized (session) {
            Workflow before = session.workflow().copy();
            T result = change.apply(session.workflow());
            if (changed.test(result)) {
                session.history().saveUndoPoint(before);
                session.markDirty();
            }
            return result;
        }
    }

    /**
     * Run an unrecorded change: viewport navigation, selection, read-only checks.
     */
    private <T> T view(String name, Function<Workflow, T> change) {
        EditorSession session = session(name);
        synchronized (session) {
            return change.apply(session.workflow());
        }
    }
}
