package com.flowcanvas.examples.order;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowcanvas.core.model.NodeId;
import com.flowcanvas.engine.service.WorkflowEditorService;
import com.flowcanvas.engine.service.WorkflowEditorService.AddNodeRequest;
import com.flowcanvas.engine.service.WorkflowEditorService.ConnectRequest;

/**
 * Order Processing flow drawn on the canvas.
 *
 * Steps:
 * 1. http-handler    - POST /orders entry point
 * 2. run             - validate the order
 * 3. service-call    - reserve inventory
 * 4. condition       - high-value check
 * 5. awakeable       - wait for human approval (high-value branch)
 * 6. service-call    - charge payment
 * 7. set-state       - record the order status
 * 8. send-message    - notify shipping
 *
 * The nodes are dropped at the same spot on purpose; auto-layout arranges them.
 */
public class OrderFlowWorkflow {

    private static final ObjectMapper mapper = new ObjectMapper();

    public static final String WORKFLOW_NAME = "order-processing";

    private final NodeId entry;
    private final NodeId validate;
    private final NodeId reserve;
    private final NodeId highValue;
    private final NodeId approval;
    private final NodeId payment;
    private final NodeId recordStatus;
    private final NodeId notifyShipping;

    private OrderFlowWorkflow(WorkflowEditorService editor, String name) {
        entry = node(editor, name, "http-handler", config("path", "/orders"));
        validate = node(editor, name, "run", mapper.createObjectNode());
        reserve = node(editor, name, "service-call", config("service", "InventoryService"));
        highValue = node(editor, name, "condition", config("expression", "order.total > 1000"));
        approval = node(editor, name, "awakeable", config("awakeable_id", "order-approval"));
        payment = node(editor, name, "service-call", config("service", "PaymentService"));
        recordStatus = node(editor, name, "set-state", config("key", "order_status"));
        notifyShipping = node(editor, name, "send-message", config("target", "ShippingService"));

        editor.connect(name, ConnectRequest.main(entry, validate));
        editor.connect(name, ConnectRequest.main(validate, reserve));
        editor.connect(name, ConnectRequest.main(reserve, highValue));
        editor.connect(name, ConnectRequest.main(highValue, approval));
        editor.connect(name, ConnectRequest.main(highValue, payment));
        editor.connect(name, ConnectRequest.main(approval, payment));
        editor.connect(name, ConnectRequest.main(payment, recordStatus));
        editor.connect(name, ConnectRequest.main(recordStatus, notifyShipping));
    }

    /**
     * Create the workflow in the editor under the given name and draw the order flow into it.
     */
    public static OrderFlowWorkflow draw(WorkflowEditorService editor, String name) {
        editor.createWorkflow(name);
        return new OrderFlowWorkflow(editor, name);
    }

    private static NodeId node(WorkflowEditorService editor, String name, String nodeType, ObjectNode config) {
        NodeId id = editor.addNode(name, AddNodeRequest.at(nodeType, 0.0, 0.0));
        editor.updateNodeConfig(name, id, config);
        return id;
    }

    private static ObjectNode config(String key, String value) {
        ObjectNode config = mapper.createObjectNode();
        config.put(key, value);
        return config;
    }

    public NodeId entry() {
        return entry;
    }

    public NodeId approval() {
        return approval;
    }

    public NodeId payment() {
        return payment;
    }

    public NodeId notifyShipping() {
        return notifyShipping;
    }

    /**
     * A back edge from the last step to the first one; the editor must refuse it.
     */
    public ConnectRequest loopBack() {
        return ConnectRequest.main(notifyShipping, entry);
    }
}
