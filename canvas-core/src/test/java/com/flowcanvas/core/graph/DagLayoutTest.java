package com.flowcanvas.core.graph;

import com.flowcanvas.core.geometry.Point;
import com.flowcanvas.core.model.Connection;
import com.flowcanvas.core.model.Node;
import com.flowcanvas.core.model.NodeId;
import com.flowcanvas.core.model.PortName;
import com.flowcanvas.core.model.Workflow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DagLayoutTest {

    private static final PortName MAIN = PortName.MAIN;
    private static final double TOLERANCE = 1e-4;

    @Test
    void apply_emptyWorkflow_shouldSkip() {
        Workflow workflow = new Workflow();

        assertEquals(LayoutOutcome.SKIPPED_EMPTY, DagLayout.defaults().apply(workflow));
        assertFalse(LayoutOutcome.SKIPPED_EMPTY.isApplied());
    }

    @Test
    void apply_chain_shouldStackLayersVertically() {
        Workflow workflow = new Workflow();
        NodeId a = workflow.addNode("http-handler", 900.0, 40.0);
        NodeId b = workflow.addNode("run", -300.0, 700.0);
        NodeId c = workflow.addNode("run", 50.0, 50.0);
        workflow.addConnectionChecked(a, b, MAIN, MAIN);
        workflow.addConnectionChecked(b, c, MAIN, MAIN);

        LayoutOutcome outcome = DagLayout.defaults().apply(workflow);

        assertEquals(LayoutOutcome.APPLIED, outcome);
        assertPosition(workflow, a, 120.0, 80.0);
        assertPosition(workflow, b, 120.0, 80.0 + 208.0);
        assertPosition(workflow, c, 120.0, 80.0 + 416.0);
    }

    @Test
    void apply_diamond_shouldSpreadSiblingsAndJoinBelow() {
        Workflow workflow = new Workflow();
        NodeId top = workflow.addNode("http-handler", 0.0, 0.0);
        NodeId left = workflow.addNode("run", 0.0, 0.0);
        NodeId right = workflow.addNode("run", 0.0, 0.0);
        NodeId join = workflow.addNode("run", 0.0, 0.0);
        workflow.addConnectionChecked(top, left, MAIN, MAIN);
        workflow.addConnectionChecked(top, right, MAIN, MAIN);
        workflow.addConnectionChecked(left, join, MAIN, MAIN);
        workflow.addConnectionChecked(right, join, MAIN, MAIN);

        DagLayout.defaults().apply(workflow);

        Node leftNode = node(workflow, left);
        Node rightNode = node(workflow, right);
        assertEquals(leftNode.y(), rightNode.y(), TOLERANCE);
        // Siblings never overlap: at least one node width plus spacing apart
        assertTrue(rightNode.x() - leftNode.x() >= 220.0 + 60.0 - TOLERANCE);
        assertTrue(node(workflow, top).y() < leftNode.y());
        assertTrue(leftNode.y() < node(workflow, join).y());
    }

    @Test
    void apply_shouldHonourConfiguredSpacing() {
        Workflow workflow = new Workflow();
        NodeId a = workflow.addNode("http-handler", 0.0, 0.0);
        NodeId b = workflow.addNode("run", 0.0, 0.0);
        NodeId c = workflow.addNode("run", 0.0, 0.0);
        workflow.addConnectionChecked(a, b, MAIN, MAIN);
        workflow.addConnectionChecked(a, c, MAIN, MAIN);

        new DagLayout(32.0, 20.0).apply(workflow);

        assertEquals(68.0 + 32.0, node(workflow, b).y() - node(workflow, a).y(), TOLERANCE);
        assertEquals(220.0 + 20.0, node(workflow, c).x() - node(workflow, b).x(), TOLERANCE);
    }

    @Test
    void apply_shouldKeepPositionsInsidePadding() {
        Workflow workflow = buildBranchyWorkflow();

        DagLayout.defaults().apply(workflow);

        for (Point position : workflow.positions()) {
            assertTrue(position.x() >= 100.0, "x=" + position.x());
            assertTrue(position.y() >= 70.0, "y=" + position.y());
        }
        double minX = workflow.positions().stream().mapToDouble(Point::x).min().orElseThrow();
        double minY = workflow.positions().stream().mapToDouble(Point::y).min().orElseThrow();
        assertEquals(DagLayout.LEFT_PADDING, minX, TOLERANCE);
        assertEquals(DagLayout.TOP_PADDING, minY, TOLERANCE);
    }

    @Test
    void apply_twice_shouldBeIdempotent() {
        Workflow workflow = buildBranchyWorkflow();

        DagLayout.defaults().apply(workflow);
        List<Point> first = workflow.positions();
        DagLayout.defaults().apply(workflow);
        List<Point> second = workflow.positions();

        for (int i = 0; i < first.size(); i++) {
            assertEquals(first.get(i).x(), second.get(i).x(), TOLERANCE);
            assertEquals(first.get(i).y(), second.get(i).y(), TOLERANCE);
        }
    }

    @Test
    void apply_shouldIgnoreStartingPositions() {
        Workflow scattered = buildBranchyWorkflow();
        Workflow moved = scattered.copy();
        for (Node node : moved.nodes()) {
            moved.placeNode(node.id(), node.x() * 3.0 - 700.0, node.y() + 12345.0);
        }

        DagLayout.defaults().apply(scattered);
        DagLayout.defaults().apply(moved);

        List<Point> expected = scattered.positions();
        List<Point> actual = moved.positions();
        for (int i = 0; i < expected.size(); i++) {
            assertEquals(expected.get(i).x(), actual.get(i).x(), TOLERANCE);
            assertEquals(expected.get(i).y(), actual.get(i).y(), TOLERANCE);
        }
    }

    @Test
    void apply_disconnectedNodes_shouldShareTopLayerWithoutOverlap() {
        Workflow workflow = new Workflow();
        NodeId a = workflow.addNode("run", 0.0, 0.0);
        NodeId b = workflow.addNode("run", 0.0, 0.0);
        NodeId c = workflow.addNode("run", 0.0, 0.0);

        DagLayout.defaults().apply(workflow);

        assertPosition(workflow, a, 120.0, 80.0);
        assertPosition(workflow, b, 400.0, 80.0);
        assertPosition(workflow, c, 680.0, 80.0);
    }

    @Test
    void apply_twice_onSeveralComponentsAndIsolatedNode_shouldBeStable() {
        Workflow workflow = new Workflow();
        NodeId orders = workflow.addNode("http-handler", 0.0, 0.0);
        NodeId charge = workflow.addNode("service-call", 0.0, 0.0);
        NodeId ship = workflow.addNode("send-message", 0.0, 0.0);
        NodeId cron = workflow.addNode("cron-trigger", 0.0, 0.0);
        NodeId cleanup = workflow.addNode("clear-state", 0.0, 0.0);
        NodeId audit = workflow.addNode("set-state", 0.0, 0.0);
        NodeId lonely = workflow.addNode("sleep", 0.0, 0.0);
        workflow.addConnectionChecked(orders, charge, MAIN, MAIN);
        workflow.addConnectionChecked(charge, ship, MAIN, MAIN);
        workflow.addConnectionChecked(cron, cleanup, MAIN, MAIN);
        workflow.addConnectionChecked(cron, audit, MAIN, MAIN);

        assertEquals(LayoutOutcome.APPLIED, DagLayout.defaults().apply(workflow));
        List<Point> first = workflow.positions();
        assertEquals(LayoutOutcome.APPLIED, DagLayout.defaults().apply(workflow));
        List<Point> second = workflow.positions();

        for (int i = 0; i < first.size(); i++) {
            assertEquals(first.get(i).x(), second.get(i).x(), TOLERANCE);
            assertEquals(first.get(i).y(), second.get(i).y(), TOLERANCE);
        }
        // Roots of both components and the isolated node share the top layer
        assertEquals(DagLayout.TOP_PADDING, node(workflow, orders).y(), TOLERANCE);
        assertEquals(DagLayout.TOP_PADDING, node(workflow, cron).y(), TOLERANCE);
        assertEquals(DagLayout.TOP_PADDING, node(workflow, lonely).y(), TOLERANCE);
        assertTrue(node(workflow, charge).y() > node(workflow, orders).y());
        assertTrue(node(workflow, ship).y() > node(workflow, charge).y());
        assertEquals(node(workflow, cleanup).y(), node(workflow, audit).y(), TOLERANCE);
    }

    @Test
    void apply_cyclicWorkflow_shouldSkipAndLeavePositions() {
        NodeId a = NodeId.random();
        NodeId b = NodeId.random();
        Workflow workflow = Workflow.restore(
            List.of(Node.create(a, "run 1", "run", 10.0, 20.0), Node.create(b, "run 2", "run", 30.0, 40.0)),
            List.of(Connection.create(a, b, MAIN, MAIN), Connection.create(b, a, MAIN, MAIN)),
            null,
            null,
            0
        );

        LayoutOutcome outcome = DagLayout.defaults().apply(workflow);

        assertEquals(LayoutOutcome.SKIPPED_CYCLIC, outcome);
        assertPosition(workflow, a, 10.0, 20.0);
        assertPosition(workflow, b, 30.0, 40.0);
    }

    @Test
    void constructor_shouldRejectInvalidSpacing() {
        assertThrows(IllegalArgumentException.class, () -> new DagLayout(-1.0, 60.0));
        assertThrows(IllegalArgumentException.class, () -> new DagLayout(140.0, Double.NaN));
    }

    private static Workflow buildBranchyWorkflow() {
        Workflow workflow = new Workflow();
        NodeId entry = workflow.addNode("http-handler", 500.0, 500.0);
        NodeId validate = workflow.addNode("run", -40.0, 80.0);
        NodeId branch = workflow.addNode("condition", 700.0, -200.0);
        NodeId approve = workflow.addNode("awakeable", 10.0, 10.0);
        NodeId charge = workflow.addNode("service-call", 1200.0, 300.0);
        NodeId notify = workflow.addNode("send-message", 0.0, 900.0);
        NodeId audit = workflow.addNode("set-state", 333.0, 444.0);
        workflow.addConnectionChecked(entry, validate, MAIN, MAIN);
        workflow.addConnectionChecked(validate, branch, MAIN, MAIN);
        workflow.addConnectionChecked(branch, approve, PortName.of("true"), MAIN);
        workflow.addConnectionChecked(branch, charge, PortName.of("false"), MAIN);
        workflow.addConnectionChecked(approve, charge, MAIN, MAIN);
        workflow.addConnectionChecked(charge, notify, MAIN, MAIN);
        workflow.addConnectionChecked(entry, audit, MAIN, MAIN);
        return workflow;
    }

    private static Node node(Workflow workflow, NodeId id) {
        return workflow.findNode(id).orElseThrow();
    }

    private static void assertPosition(Workflow workflow, NodeId id, double x, double y) {
        Node node = node(workflow, id);
        assertEquals(x, node.x(), TOLERANCE);
        assertEquals(y, node.y(), TOLERANCE);
    }
}
