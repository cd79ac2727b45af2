package com.flowcanvas.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Palette category of a node type.
 */
public enum NodeCategory {
    /**
     * Handlers and triggers that start a workflow.
     */
    ENTRY,

    /**
     * Journaled steps and calls.
     */
    DURABLE,

    /**
     * Keyed state access.
     */
    STATE,

    /**
     * Branching, looping and compensation.
     */
    FLOW,

    /**
     * Durable timers and timeouts.
     */
    TIMING,

    /**
     * Promises, awakeables and signals.
     */
    SIGNAL;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NodeCategory fromKey(String key) {
        return valueOf(key.toUpperCase(Locale.ROOT));
    }
}
