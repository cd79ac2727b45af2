package com.flowcanvas.core.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed table of the node types the editor knows about.
 * Maps the string key stored on a node to its palette metadata and declared port types.
 * Unknown keys resolve to {@link #UNKNOWN}, never to a failure.
 */
public enum NodeType {
    // Entry
    HTTP_HANDLER("http-handler", NodeCategory.ENTRY, "HTTP Handler", "globe", PortType.NONE, PortType.EVENT),
    KAFKA_HANDLER("kafka-handler", NodeCategory.ENTRY, "Kafka Consumer", "kafka", PortType.NONE, PortType.EVENT),
    CRON_TRIGGER("cron-trigger", NodeCategory.ENTRY, "Cron Trigger", "clock", PortType.NONE, PortType.EVENT),
    WORKFLOW_SUBMIT("workflow-submit", NodeCategory.ENTRY, "Workflow Submit", "play-circle", PortType.NONE, PortType.EVENT),

    // Durable
    RUN("run", NodeCategory.DURABLE, "Durable Step", "shield", PortType.ANY, PortType.JSON),
    SERVICE_CALL("service-call", NodeCategory.DURABLE, "Service Call", "arrow-right", PortType.ANY, PortType.JSON),
    OBJECT_CALL("object-call", NodeCategory.DURABLE, "Object Call", "box", PortType.ANY, PortType.JSON),
    WORKFLOW_CALL("workflow-call", NodeCategory.DURABLE, "Workflow Call", "workflow", PortType.ANY, PortType.JSON),
    SEND_MESSAGE("send-message", NodeCategory.DURABLE, "Send Message", "send", PortType.JSON, PortType.ANY),
    DELAYED_SEND("delayed-send", NodeCategory.DURABLE, "Delayed Message", "clock-send", PortType.JSON, PortType.ANY),

    // State
    GET_STATE("get-state", NodeCategory.STATE, "Get State", "download", PortType.ANY, PortType.STATE),
    SET_STATE("set-state", NodeCategory.STATE, "Set State", "upload", PortType.JSON, PortType.ANY),
    CLEAR_STATE("clear-state", NodeCategory.STATE, "Clear State", "eraser", PortType.ANY, PortType.ANY),

    // Flow
    CONDITION("condition", NodeCategory.FLOW, "If / Else", "git-branch", PortType.ANY, PortType.ANY),
    SWITCH("switch", NodeCategory.FLOW, "Switch", "git-fork", PortType.ANY, PortType.ANY),
    LOOP("loop", NodeCategory.FLOW, "Loop / Iterate", "repeat", PortType.ANY, PortType.ANY),
    PARALLEL("parallel", NodeCategory.FLOW, "Parallel", "layers", PortType.ANY, PortType.ANY),
    COMPENSATE("compensate", NodeCategory.FLOW, "Compensate", "undo", PortType.ANY, PortType.ANY),

    // Timing
    SLEEP("sleep", NodeCategory.TIMING, "Sleep / Timer", "timer", PortType.ANY, PortType.ANY),
    TIMEOUT("timeout", NodeCategory.TIMING, "Timeout", "alarm", PortType.ANY, PortType.ANY),

    // Signal
    DURABLE_PROMISE("durable-promise", NodeCategory.SIGNAL, "Durable Promise", "sparkles", PortType.ANY, PortType.SIGNAL),
    AWAKEABLE("awakeable", NodeCategory.SIGNAL, "Awakeable", "bell", PortType.ANY, PortType.SIGNAL),
    RESOLVE_PROMISE("resolve-promise", NodeCategory.SIGNAL, "Resolve Promise", "check-circle", PortType.JSON, PortType.ANY),
    SIGNAL_HANDLER("signal-handler", NodeCategory.SIGNAL, "Signal Handler", "radio", PortType.SIGNAL, PortType.JSON),

    /**
     * Fallback for keys outside the table. Declares no port types.
     */
    UNKNOWN("unknown", NodeCategory.DURABLE, "Unknown Node", "help-circle", null, null);

    private static final Map<String, NodeType> BY_KEY = Arrays.stream(values())
        .filter(type -> type != UNKNOWN)
        .collect(Collectors.toUnmodifiableMap(NodeType::key, Function.identity()));

    private final String key;
    private final NodeCategory category;
    private final String label;
    private final String icon;
    private final PortType inputType;
    private final PortType outputType;

    NodeType(String key, NodeCategory category, String label, String icon,
             PortType inputType, PortType outputType) {
        this.key = key;
        this.category = category;
        this.label = label;
        this.icon = icon;
        this.inputType = inputType;
        this.outputType = outputType;
    }

    /**
     * Resolve a node-type key. Unknown or null keys resolve to {@link #UNKNOWN}.
     */
    public static NodeType fromKey(String key) {
        if (key == null) {
            return UNKNOWN;
        }
        return BY_KEY.getOrDefault(key, UNKNOWN);
    }

    public String key() {
        return key;
    }

    public NodeCategory category() {
        return category;
    }

    public String label() {
        return label;
    }

    public String icon() {
        return icon;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    public boolean isEntry() {
        return category == NodeCategory.ENTRY;
    }

    /**
     * Declared type of the input port, empty for unknown node types.
     */
    public Optional<PortType> inputType() {
        return Optional.ofNullable(inputType);
    }

    /**
     * Declared type of the output port, empty for unknown node types.
     */
    public Optional<PortType> outputType() {
        return Optional.ofNullable(outputType);
    }
}
