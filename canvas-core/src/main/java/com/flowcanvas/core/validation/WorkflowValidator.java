package com.flowcanvas.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowcanvas.core.model.Connection;
import com.flowcanvas.core.model.Node;
import com.flowcanvas.core.model.NodeId;
import com.flowcanvas.core.model.NodeType;
import com.flowcanvas.core.model.Workflow;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structural checks run before a workflow is handed to execution.
 * Read-only; never throws for a malformed workflow, every problem becomes an issue.
 *
 * Rules, in reporting order:
 * 1. entry point present
 * 2. every node reachable from an entry node or fed by some connection
 * 3. no orphan non-entry nodes
 * 4. known node types with their required configuration
 * 5. connections reference existing nodes
 */
public final class WorkflowValidator {

    private static final Map<NodeType, List<ConfigRule>> CONFIG_RULES = configRules();

    private WorkflowValidator() {
    }

    public static ValidationResult validate(Workflow workflow) {
        List<ValidationIssue> issues = new ArrayList<>();

        if (workflow.nodes().isEmpty()) {
            issues.add(ValidationIssue.error("Workflow has no nodes"));
            return new ValidationResult(issues);
        }

        validateEntryPoints(workflow, issues);
        validateReachability(workflow, issues);
        validateOrphanNodes(workflow, issues);
        validateRequiredConfig(workflow, issues);
        validateConnectionEndpoints(workflow, issues);

        return new ValidationResult(issues);
    }

    private static void validateEntryPoints(Workflow workflow, List<ValidationIssue> issues) {
        boolean hasEntry = workflow.nodes().stream().anyMatch(node -> node.type().isEntry());
        if (!hasEntry) {
            issues.add(ValidationIssue.error(
                "Workflow has no entry point (e.g., HTTP Handler, Kafka Handler)"));
        }
    }

    private static void validateReachability(Workflow workflow, List<ValidationIssue> issues) {
        if (workflow.connections().isEmpty()) {
            return;
        }
        Deque<NodeId> stack = workflow.nodes().stream()
            .filter(node -> node.type().isEntry())
            .map(Node::id)
            .collect(Collectors.toCollection(ArrayDeque::new));
        if (stack.isEmpty()) {
            return;
        }

        Set<NodeId> reachable = new HashSet<>();
        while (!stack.isEmpty()) {
            NodeId current = stack.pop();
            if (reachable.add(current)) {
                for (Connection connection : workflow.connections()) {
                    if (connection.source().equals(current) && !reachable.contains(connection.target())) {
                        stack.push(connection.target());
                    }
                }
            }
        }

        for (Node node : workflow.nodes()) {
            if (reachable.contains(node.id()) || node.type().isEntry()) {
                continue;
            }
            if (!hasIncoming(workflow, node.id())) {
                issues.add(ValidationIssue.warning(
                    "Node '" + node.name() + "' is not reachable from any entry point", node.id()));
            }
        }
    }

    private static void validateOrphanNodes(Workflow workflow, List<ValidationIssue> issues) {
        if (workflow.nodes().size() < 2) {
            return;
        }
        for (Node node : workflow.nodes()) {
            if (node.type().isEntry()) {
                continue;
            }
            boolean incoming = hasIncoming(workflow, node.id());
            boolean outgoing = workflow.connections().stream().anyMatch(c -> c.source().equals(node.id()));

            if (!incoming && !outgoing) {
                issues.add(ValidationIssue.warning(
                    "Node '" + node.name() + "' is not connected to anything", node.id()));
            } else if (!incoming) {
                issues.add(ValidationIssue.warning(
                    "Node '" + node.name() + "' has no incoming connections", node.id()));
            }
        }
    }

    private static void validateRequiredConfig(Workflow workflow, List<ValidationIssue> issues) {
        for (Node node : workflow.nodes()) {
            NodeType type = node.type();
            if (!type.isKnown()) {
                issues.add(ValidationIssue.error("Unknown node type: " + node.nodeType(), node.id()));
                continue;
            }
            for (ConfigRule rule : CONFIG_RULES.getOrDefault(type, List.of())) {
                if (!rule.isSatisfiedBy(node.config())) {
                    issues.add(new ValidationIssue(rule.severity(), rule.message(), node.id()));
                }
            }
        }
    }

    private static void validateConnectionEndpoints(Workflow workflow, List<ValidationIssue> issues) {
        Set<NodeId> nodeIds = workflow.nodes().stream().map(Node::id).collect(Collectors.toSet());
        for (Connection connection : workflow.connections()) {
            if (!nodeIds.contains(connection.source())) {
                issues.add(ValidationIssue.error("Connection references non-existent source node"));
            }
            if (!nodeIds.contains(connection.target())) {
                issues.add(ValidationIssue.error("Connection references non-existent target node"));
            }
        }
    }

    private static boolean hasIncoming(Workflow workflow, NodeId nodeId) {
        return workflow.connections().stream().anyMatch(c -> c.target().equals(nodeId));
    }

    private static Map<NodeType, List<ConfigRule>> configRules() {
        Map<NodeType, List<ConfigRule>> rules = new EnumMap<>(NodeType.class);
        rules.put(NodeType.HTTP_HANDLER, List.of(ConfigRule.text("path", "HTTP Handler requires a path")));
        rules.put(NodeType.KAFKA_HANDLER, List.of(ConfigRule.text("topic", "Kafka Handler requires a topic")));
        rules.put(NodeType.CRON_TRIGGER, List.of(ConfigRule.text("schedule", "Cron Trigger requires a schedule")));
        rules.put(NodeType.WORKFLOW_SUBMIT,
            List.of(ConfigRule.text("workflow_name", "Workflow Submit requires a workflow name")));
        rules.put(NodeType.SERVICE_CALL, List.of(ConfigRule.text("service", "Service Call requires a service name")));
        rules.put(NodeType.OBJECT_CALL,
            List.of(ConfigRule.text("object_name", "Object Call requires an object name")));
        rules.put(NodeType.WORKFLOW_CALL,
            List.of(ConfigRule.text("workflow_name", "Workflow Call requires a workflow name")));
        rules.put(NodeType.SEND_MESSAGE, List.of(ConfigRule.text("target", "Send Message requires a target")));
        rules.put(NodeType.DELAYED_SEND, List.of(
            ConfigRule.text("target", "Delayed Send requires a target"),
            ConfigRule.positiveNumber("delay_ms", "Delayed Send should have a non-zero delay")));
        rules.put(NodeType.GET_STATE, List.of(ConfigRule.text("key", "Get State requires a key")));
        rules.put(NodeType.SET_STATE, List.of(ConfigRule.text("key", "Set State requires a key")));
        rules.put(NodeType.CLEAR_STATE, List.of(ConfigRule.text("key", "Clear State requires a key")));
        rules.put(NodeType.CONDITION, List.of(ConfigRule.text("expression", "Condition requires an expression")));
        rules.put(NodeType.SWITCH, List.of(ConfigRule.text("expression", "Switch requires an expression")));
        rules.put(NodeType.LOOP, List.of(ConfigRule.textAdvisory("iterator", "Loop should have an iterator expression")));
        rules.put(NodeType.PARALLEL,
            List.of(ConfigRule.positiveNumber("branches", "Parallel should have at least one branch")));
        rules.put(NodeType.SLEEP, List.of(ConfigRule.positiveNumber("duration_ms", "Sleep should have a non-zero duration")));
        rules.put(NodeType.TIMEOUT,
            List.of(ConfigRule.positiveNumber("timeout_ms", "Timeout should have a non-zero duration")));
        rules.put(NodeType.DURABLE_PROMISE,
            List.of(ConfigRule.text("promise_name", "Durable Promise requires a promise name")));
        rules.put(NodeType.AWAKEABLE, List.of(ConfigRule.text("awakeable_id", "Awakeable requires an awakeable ID")));
        rules.put(NodeType.RESOLVE_PROMISE,
            List.of(ConfigRule.text("promise_name", "Resolve Promise requires a promise name")));
        rules.put(NodeType.SIGNAL_HANDLER,
            List.of(ConfigRule.text("signal_name", "Signal Handler requires a signal name")));
        return rules;
    }

    /**
     * A required configuration key. Text keys fail when missing or blank,
     * numeric keys when missing or zero.
     */
    private record ConfigRule(String key, boolean numeric, ValidationSeverity severity, String message) {

        static ConfigRule text(String key, String message) {
            return new ConfigRule(key, false, ValidationSeverity.ERROR, message);
        }

        static ConfigRule textAdvisory(String key, String message) {
            return new ConfigRule(key, false, ValidationSeverity.WARNING, message);
        }

        static ConfigRule positiveNumber(String key, String message) {
            return new ConfigRule(key, true, ValidationSeverity.WARNING, message);
        }

        boolean isSatisfiedBy(JsonNode config) {
            JsonNode value = config.get(key);
            if (value == null || value.isNull()) {
                return false;
            }
            if (numeric) {
                return value.isNumber() && value.asDouble() != 0.0;
            }
            return value.isTextual() && !value.asText().isBlank();
        }
    }
}
