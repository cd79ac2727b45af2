package com.flowcanvas.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Objects;

/**
 * Named connection endpoint on a node. Compared exactly, case included.
 */
public record PortName(String value) {

    /**
     * Default port used by every node type.
     */
    public static final PortName MAIN = new PortName("main");

    public PortName {
        Objects.requireNonNull(value, "value");
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PortName of(String value) {
        return new PortName(value);
    }

    @JsonValue
    public String asString() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
