package com.flowcanvas.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Objects;
import java.util.UUID;

/**
 * Opaque, comparable identifier of a node.
 * Serialised as the bare UUID string.
 */
public record NodeId(UUID value) implements Comparable<NodeId> {

    public NodeId {
        Objects.requireNonNull(value, "value");
    }

    /**
     * Generate a fresh random id.
     */
    public static NodeId random() {
        return new NodeId(UUID.randomUUID());
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static NodeId of(String value) {
        return new NodeId(UUID.fromString(value));
    }

    @JsonValue
    public String asString() {
        return value.toString();
    }

    @Override
    public int compareTo(NodeId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
