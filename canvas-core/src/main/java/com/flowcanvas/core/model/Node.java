package com.flowcanvas.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * A node placed on the workflow canvas.
 * Immutable: every mutation on the owning {@link Workflow} replaces the node with a modified copy.
 *
 * Invariants:
 * - id is unique within its workflow
 * - x and y are finite
 * - config is never null (an empty object when unset)
 */
public record Node(
    // Identity
    NodeId id,
    String name,
    String description,
    @JsonProperty("node_type") String nodeType,
    NodeCategory category,
    String icon,

    // Canvas position (model space)
    double x,
    double y,

    // Data
    JsonNode config,
    @JsonProperty("last_output") JsonNode lastOutput,

    // Transient UI flags
    boolean selected,
    boolean executing,
    boolean skipped,
    String error
) {
    public Node {
        Objects.requireNonNull(id, "id");
        if (config == null || config.isNull()) {
            config = JsonNodeFactory.instance.objectNode();
        }
        if (lastOutput != null && lastOutput.isNull()) {
            lastOutput = null;
        }
    }

    /**
     * Create a fresh node from the node-type table at the given position.
     */
    public static Node create(NodeId id, String name, String nodeType, double x, double y) {
        NodeType type = NodeType.fromKey(nodeType);
        return new Node(
            id,
            name,
            type.label(),
            nodeType,
            type.category(),
            type.icon(),
            x,
            y,
            JsonNodeFactory.instance.objectNode(),
            null,
            false,
            false,
            false,
            null
        );
    }

    /**
     * Resolve this node's entry in the node-type table.
     */
    public NodeType type() {
        return NodeType.fromKey(nodeType);
    }

    /**
     * Check if the node carries an execution error.
     */
    public boolean hasError() {
        return error != null;
    }

    /**
     * Create a copy moved to the given position.
     */
    public Node withPosition(double newX, double newY) {
        return toBuilder().x(newX).y(newY).build();
    }

    /**
     * Create a copy with the selection flag changed.
     */
    public Node withSelected(boolean newSelected) {
        return toBuilder().selected(newSelected).build();
    }

    /**
     * Create a copy with a replaced configuration document. The document is copied, so later
     * changes to the caller's instance do not reach the node.
     */
    public Node withConfig(JsonNode newConfig) {
        return toBuilder().config(newConfig != null ? newConfig.deepCopy() : null).build();
    }

    /**
     * Create a copy with runtime flags cleared and {@code config.status} set to the given value.
     */
    public Node withRuntimeReset(String status) {
        ObjectNode newConfig = config.isObject()
            ? ((ObjectNode) config).deepCopy()
            : JsonNodeFactory.instance.objectNode();
        newConfig.put("status", status);
        return toBuilder()
            .config(newConfig)
            .lastOutput(null)
            .executing(false)
            .skipped(false)
            .error(null)
            .build();
    }

    /**
     * Deep copy. The JSON documents are mutable, so snapshots must not share them.
     */
    public Node copy() {
        return toBuilder()
            .config(config.deepCopy())
            .lastOutput(lastOutput != null ? lastOutput.deepCopy() : null)
            .build();
    }

    /**
     * Builder for creating modified copies.
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private final NodeId id;
        private String name;
        private String description;
        private String nodeType;
        private NodeCategory category;
        private String icon;
        private double x;
        private double y;
        private JsonNode config;
        private JsonNode lastOutput;
        private boolean selected;
        private boolean executing;
        private boolean skipped;
        private String error;

        public Builder(Node node) {
            this.id = node.id();
            this.name = node.name();
            this.description = node.description();
            this.nodeType = node.nodeType();
            this.category = node.category();
            this.icon = node.icon();
            this.x = node.x();
            this.y = node.y();
            this.config = node.config();
            this.lastOutput = node.lastOutput();
            this.selected = node.selected();
            this.executing = node.executing();
            this.skipped = node.skipped();
            this.error = node.error();
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder x(double x) {
            this.x = x;
            return this;
        }

        public Builder y(double y) {
            this.y = y;
            return this;
        }

        public Builder config(JsonNode config) {
            this.config = config;
            return this;
        }

        public Builder lastOutput(JsonNode lastOutput) {
            this.lastOutput = lastOutput;
            return this;
        }

        public Builder selected(boolean selected) {
            this.selected = selected;
            return this;
        }

        public Builder executing(boolean executing) {
            this.executing = executing;
            return this;
        }

        public Builder skipped(boolean skipped) {
            this.skipped = skipped;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Node build() {
            return new Node(
                id, name, description, nodeType, category, icon,
                x, y, config, lastOutput,
                selected, executing, skipped, error
            );
        }
    }
}
