package com.flowcanvas.engine.logging;

import com.flowcanvas.core.model.NodeId;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for editor logging.
 * Every log line emitted inside the context carries the workflow name and operation.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forOperation(workflowName, "autoLayout")) {
 *     log.info("Applying layout"); // includes workflow, operation, traceId
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String WORKFLOW = "workflow";
    public static final String NODE_ID = "nodeId";
    public static final String OPERATION = "operation";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for a workflow-level editor operation.
     */
    public static LoggingContext forOperation(String workflowName, String operation) {
        return forNode(workflowName, null, operation);
    }

    /**
     * Create a logging context for an operation on a single node.
     */
    public static LoggingContext forNode(String workflowName, NodeId nodeId, String operation) {
        LoggingContext ctx = new LoggingContext();
        if (workflowName != null) {
            MDC.put(WORKFLOW, workflowName);
        }
        if (nodeId != null) {
            MDC.put(NODE_ID, nodeId.toString());
        }
        if (operation != null) {
            MDC.put(OPERATION, operation);
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Attach a node id to the current context, e.g. once a new node has been created.
     */
    public static void setNodeId(NodeId nodeId) {
        if (nodeId != null) {
            MDC.put(NODE_ID, nodeId.toString());
        }
    }

    public static String getWorkflow() {
        return MDC.get(WORKFLOW);
    }

    public static String getOperation() {
        return MDC.get(OPERATION);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(WORKFLOW);
        MDC.remove(NODE_ID);
        MDC.remove(OPERATION);
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a request.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
