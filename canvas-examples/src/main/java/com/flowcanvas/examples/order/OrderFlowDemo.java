package com.flowcanvas.examples.order;

import com.flowcanvas.core.codec.WorkflowCodec;
import com.flowcanvas.core.exception.ConnectionException;
import com.flowcanvas.core.graph.LayoutOutcome;
import com.flowcanvas.core.model.Node;
import com.flowcanvas.core.model.NodeId;
import com.flowcanvas.core.model.Workflow;
import com.flowcanvas.core.validation.ValidationIssue;
import com.flowcanvas.core.validation.ValidationResult;
import com.flowcanvas.engine.config.EditorConfiguration;
import com.flowcanvas.engine.service.WorkflowEditorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import java.util.List;

/**
 * Demonstration runner for the Order Processing flow.
 *
 * Shows:
 * 1. Drawing a durable workflow through the editor service
 * 2. A refused back edge (cycle prevention)
 * 3. Structural validation
 * 4. Auto-layout and fit-to-view
 * 5. Undo / redo
 * 6. Execution order and the stored JSON document
 */
public class OrderFlowDemo {

    private static final Logger log = LoggerFactory.getLogger(OrderFlowDemo.class);

    public static void main(String[] args) {
        log.info("╔══════════════════════════════════════════════════════════════════════╗");
        log.info("║         FLOW CANVAS - ORDER PROCESSING DEMONSTRATION                 ║");
        log.info("╚══════════════════════════════════════════════════════════════════════╝");
        log.info("");

        try (AnnotationConfigApplicationContext context =
                 new AnnotationConfigApplicationContext(EditorConfiguration.class)) {
            WorkflowEditorService editor = context.getBean(WorkflowEditorService.class);
            WorkflowCodec codec = context.getBean(WorkflowCodec.class);
            run(editor, codec);
        }

        log.info("");
        log.info("╔══════════════════════════════════════════════════════════════════════╗");
        log.info("║                    DEMONSTRATION COMPLETE                            ║");
        log.info("╚══════════════════════════════════════════════════════════════════════╝");
    }

    static void run(WorkflowEditorService editor, WorkflowCodec codec) {
        String name = OrderFlowWorkflow.WORKFLOW_NAME;

        section("Drawing the order flow");
        OrderFlowWorkflow flow = OrderFlowWorkflow.draw(editor, name);
        Workflow drawn = editor.getWorkflow(name);
        log.info("Drew {} nodes and {} connections", drawn.nodes().size(), drawn.connections().size());

        section("Refusing a back edge");
        try {
            editor.connect(name, flow.loopBack());
            log.error("Back edge was accepted");
        } catch (ConnectionException e) {
            log.info("✓ Refused [{}]: {}", e.getErrorCode(), e.getMessage());
        }

        section("Validating");
        ValidationResult validation = editor.validate(name);
        for (ValidationIssue issue : validation.issues()) {
            log.info("  {} {}", issue.severity(), issue.message());
        }
        log.info("Valid: {}", validation.isValid());

        section("Auto-layout and fit");
        LayoutOutcome outcome = editor.autoLayout(name);
        editor.fitView(name, 1280, 800);
        Workflow laidOut = editor.getWorkflow(name);
        log.info("Layout outcome: {}", outcome);
        for (Node node : laidOut.nodes()) {
            log.info("  {} at ({}, {})", node.name(), node.x(), node.y());
        }
        log.info("Viewport: {}", laidOut.viewport());

        section("Undo / redo");
        editor.undo(name);
        log.info("After undo, entry sits at {}", position(editor.getWorkflow(name), flow.entry()));
        editor.redo(name);
        log.info("After redo, entry sits at {}", position(editor.getWorkflow(name), flow.entry()));

        section("Preparing a run");
        List<NodeId> queue = editor.prepareRun(name);
        Workflow prepared = editor.getWorkflow(name);
        for (int i = 0; i < queue.size(); i++) {
            NodeId id = queue.get(i);
            String stepName = prepared.findNode(id).map(Node::name).orElse(id.toString());
            log.info("  {}. {}", i + 1, stepName);
        }

        editor.saveWorkflow(name);
        log.info("");
        log.info("Stored document:\n{}", codec.encodePretty(prepared));
        editor.closeWorkflow(name);
    }

    private static String position(Workflow workflow, NodeId id) {
        return workflow.findNode(id)
            .map(node -> "(" + node.x() + ", " + node.y() + ")")
            .orElse("(missing)");
    }

    private static void section(String title) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════════════");
        log.info(title);
        log.info("═══════════════════════════════════════════════════════════════════════");
    }
}
