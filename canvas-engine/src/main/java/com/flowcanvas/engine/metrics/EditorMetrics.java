package com.flowcanvas.engine.metrics;

import com.flowcanvas.core.graph.LayoutOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the workflow editor.
 *
 * Metrics exposed:
 * - nodes added / removed
 * - connections created (by type warning) and rejected (by error code)
 * - auto-layout runs by outcome
 * - undo / redo steps
 * - open editor sessions
 */
public class EditorMetrics implements MeterBinder {

    // Metric names
    public static final String NODES_ADDED = "canvas.nodes.added";
    public static final String NODES_REMOVED = "canvas.nodes.removed";

    public static final String CONNECTIONS_CREATED = "canvas.connections.created";
    public static final String CONNECTIONS_REJECTED = "canvas.connections.rejected";

    public static final String LAYOUTS = "canvas.layouts";

    public static final String UNDO = "canvas.history.undo";
    public static final String REDO = "canvas.history.redo";

    public static final String OPEN_SESSIONS = "canvas.sessions.open";

    private MeterRegistry registry;

    private final AtomicInteger openSessions = new AtomicInteger(0);

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder(OPEN_SESSIONS, openSessions, AtomicInteger::get)
            .description("Number of workflows open in the editor")
            .register(registry);
    }

    // ========== Node Metrics ==========

    public void nodeAdded(String nodeType) {
        Counter.builder(NODES_ADDED)
            .tag("node_type", nodeType)
            .description("Total nodes added to workflows")
            .register(registry)
            .increment();
    }

    public void nodeRemoved() {
        Counter.builder(NODES_REMOVED)
            .description("Total nodes removed from workflows")
            .register(registry)
            .increment();
    }

    // ========== Connection Metrics ==========

    public void connectionCreated(boolean typeWarning) {
        Counter.builder(CONNECTIONS_CREATED)
            .tag("warning", String.valueOf(typeWarning))
            .description("Total connections created")
            .register(registry)
            .increment();
    }

    public void connectionRejected(String errorCode) {
        Counter.builder(CONNECTIONS_REJECTED)
            .tag("error_code", errorCode)
            .description("Total connection requests refused")
            .register(registry)
            .increment();
    }

    // ========== Layout Metrics ==========

    public void layoutRun(LayoutOutcome outcome) {
        Counter.builder(LAYOUTS)
            .tag("outcome", outcome.name())
            .description("Total auto-layout runs")
            .register(registry)
            .increment();
    }

    // ========== History Metrics ==========

    public void undoApplied() {
        Counter.builder(UNDO)
            .description("Total undo steps applied")
            .register(registry)
            .increment();
    }

    public void redoApplied() {
        Counter.builder(REDO)
            .description("Total redo steps applied")
            .register(registry)
            .increment();
    }

    // ========== Session Metrics ==========

    public void sessionOpened() {
        openSessions.incrementAndGet();
    }

    public void sessionClosed() {
        openSessions.updateAndGet(current -> Math.max(0, current - 1));
    }

    public int getOpenSessions() {
        return openSessions.get();
    }
}
