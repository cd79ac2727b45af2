package com.flowcanvas.core.graph;

import com.flowcanvas.core.model.Connection;
import com.flowcanvas.core.model.Node;
import com.flowcanvas.core.model.NodeId;
import com.flowcanvas.core.model.PortName;
import com.flowcanvas.core.model.Workflow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionPlannerTest {

    private static final PortName MAIN = PortName.MAIN;

    @Test
    void plan_emptyWorkflow_shouldBeEmpty() {
        assertTrue(ExecutionPlanner.plan(new Workflow()).isEmpty());
    }

    @Test
    void plan_chain_shouldFollowConnections() {
        Workflow workflow = new Workflow();
        NodeId a = workflow.addNode("http-handler", 0.0, 0.0);
        NodeId b = workflow.addNode("run", 300.0, 0.0);
        NodeId c = workflow.addNode("run", 600.0, 0.0);
        workflow.addConnectionChecked(b, c, MAIN, MAIN);
        workflow.addConnectionChecked(a, b, MAIN, MAIN);

        assertEquals(List.of(a, b, c), ExecutionPlanner.plan(workflow));
    }

    @Test
    void plan_independentNodes_shouldTakeLastNameFirst() {
        Workflow workflow = new Workflow();
        NodeId first = workflow.addNode("run", 0.0, 0.0);
        NodeId second = workflow.addNode("run", 300.0, 0.0);
        NodeId third = workflow.addNode("run", 600.0, 0.0);

        // Ready nodes are sorted by name ("run 1" < "run 2" < "run 3") and taken from the end
        assertEquals(List.of(third, second, first), ExecutionPlanner.plan(workflow));
    }

    @Test
    void plan_shouldFinishBranchBeforeNextRoot() {
        Workflow workflow = new Workflow();
        NodeId http = workflow.addNode("http-handler", 0.0, 0.0);
        NodeId kafka = workflow.addNode("kafka-handler", 300.0, 0.0);
        NodeId afterHttp = workflow.addNode("run", 0.0, 300.0);
        NodeId afterKafka = workflow.addNode("run", 300.0, 300.0);
        workflow.addConnectionChecked(http, afterHttp, MAIN, MAIN);
        workflow.addConnectionChecked(kafka, afterKafka, MAIN, MAIN);

        // "kafka-handler 2" sorts after "http-handler 1", so its branch runs first
        assertEquals(List.of(kafka, afterKafka, http, afterHttp), ExecutionPlanner.plan(workflow));
    }

    @Test
    void plan_join_shouldWaitForAllParents() {
        Workflow workflow = new Workflow();
        NodeId entry = workflow.addNode("http-handler", 0.0, 0.0);
        NodeId left = workflow.addNode("run", 0.0, 300.0);
        NodeId right = workflow.addNode("run", 300.0, 300.0);
        NodeId join = workflow.addNode("run", 0.0, 600.0);
        workflow.addConnectionChecked(entry, left, MAIN, MAIN);
        workflow.addConnectionChecked(entry, right, MAIN, MAIN);
        workflow.addConnectionChecked(left, join, MAIN, MAIN);
        workflow.addConnectionChecked(right, join, MAIN, MAIN);

        List<NodeId> plan = ExecutionPlanner.plan(workflow);

        assertEquals(4, plan.size());
        assertEquals(entry, plan.get(0));
        assertEquals(join, plan.get(3));
    }

    @Test
    void plan_cyclicNodes_shouldNotBeScheduled() {
        NodeId a = NodeId.random();
        NodeId b = NodeId.random();
        NodeId lone = NodeId.random();
        Workflow workflow = Workflow.restore(
            List.of(
                Node.create(a, "run 1", "run", 0.0, 0.0),
                Node.create(b, "run 2", "run", 300.0, 0.0),
                Node.create(lone, "run 3", "run", 600.0, 0.0)
            ),
            List.of(Connection.create(a, b, MAIN, MAIN), Connection.create(b, a, MAIN, MAIN)),
            null,
            null,
            0
        );

        assertEquals(List.of(lone), ExecutionPlanner.plan(workflow));
    }
}
