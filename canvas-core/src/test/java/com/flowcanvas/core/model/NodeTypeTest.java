package com.flowcanvas.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NodeTypeTest {

    @Test
    void fromKey_shouldResolveKnownTypes() {
        NodeType type = NodeType.fromKey("http-handler");

        assertEquals(NodeType.HTTP_HANDLER, type);
        assertEquals("HTTP Handler", type.label());
        assertEquals("globe", type.icon());
        assertEquals(NodeCategory.ENTRY, type.category());
        assertTrue(type.isEntry());
        assertTrue(type.isKnown());
    }

    @Test
    void fromKey_shouldFallBackToUnknown() {
        NodeType type = NodeType.fromKey("teleport");

        assertEquals(NodeType.UNKNOWN, type);
        assertEquals("Unknown Node", type.label());
        assertEquals("help-circle", type.icon());
        assertEquals(NodeCategory.DURABLE, type.category());
        assertFalse(type.isKnown());
        assertTrue(type.inputType().isEmpty());
        assertTrue(type.outputType().isEmpty());
    }

    @Test
    void fromKey_withNull_shouldReturnUnknown() {
        assertEquals(NodeType.UNKNOWN, NodeType.fromKey(null));
    }

    @Test
    void fromKey_shouldNotResolveFallbackKey() {
        // "unknown" is not a palette entry, it only names the fallback
        assertFalse(NodeType.fromKey("unknown").isKnown());
    }

    @Test
    void everyKnownType_shouldRoundTripThroughItsKey() {
        for (NodeType type : NodeType.values()) {
            if (type.isKnown()) {
                assertEquals(type, NodeType.fromKey(type.key()));
                assertTrue(type.inputType().isPresent(), type.key());
                assertTrue(type.outputType().isPresent(), type.key());
            }
        }
    }

    @Test
    void entryTypes_shouldAcceptNoInput() {
        for (NodeType type : NodeType.values()) {
            if (type.isEntry()) {
                assertEquals(PortType.NONE, type.inputType().orElseThrow(), type.key());
            }
        }
    }

    @Test
    void canFeed_shouldFollowCompatibilityRules() {
        assertTrue(PortType.ANY.canFeed(PortType.SIGNAL));
        assertTrue(PortType.JSON.canFeed(PortType.ANY));
        assertTrue(PortType.SIGNAL.canFeed(PortType.SIGNAL));
        assertTrue(PortType.EVENT.canFeed(PortType.JSON));
        assertTrue(PortType.STATE.canFeed(PortType.JSON));

        assertFalse(PortType.JSON.canFeed(PortType.EVENT));
        assertFalse(PortType.EVENT.canFeed(PortType.SIGNAL));
        assertFalse(PortType.JSON.canFeed(PortType.NONE));
    }
}
