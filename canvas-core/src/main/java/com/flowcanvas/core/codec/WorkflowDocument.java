package com.flowcanvas.core.codec;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowcanvas.core.model.Connection;
import com.flowcanvas.core.model.Node;
import com.flowcanvas.core.model.NodeId;
import com.flowcanvas.core.model.Viewport;
import com.flowcanvas.core.model.Workflow;

import java.util.List;

/**
 * Wire shape of a stored workflow.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record WorkflowDocument(
    List<Node> nodes,
    List<Connection> connections,
    Viewport viewport,
    @JsonProperty("execution_queue") List<NodeId> executionQueue,
    @JsonProperty("current_step") int currentStep
) {

    static WorkflowDocument from(Workflow workflow) {
        return new WorkflowDocument(
            workflow.nodes(),
            workflow.connections(),
            workflow.viewport(),
            workflow.executionQueue(),
            workflow.currentStep()
        );
    }

    Workflow toWorkflow() {
        return Workflow.restore(nodes, connections, viewport, executionQueue, currentStep);
    }
}
