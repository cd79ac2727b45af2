package com.flowcanvas.engine.metrics;

import com.flowcanvas.core.graph.LayoutOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Editor Metrics Tests")
public class EditorMetricsTest {

    private SimpleMeterRegistry registry;
    private EditorMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new EditorMetrics();
        metrics.bindTo(registry);
    }

    @Test
    @DisplayName("Open-session gauge should never go negative")
    void testSessionGauge() {
        metrics.sessionOpened();
        metrics.sessionOpened();
        metrics.sessionClosed();
        metrics.sessionClosed();
        metrics.sessionClosed();

        assertThat(metrics.getOpenSessions()).isZero();
        assertThat(registry.get(EditorMetrics.OPEN_SESSIONS).gauge().value()).isZero();
    }

    @Test
    @DisplayName("Layout counter should be tagged by outcome")
    void testLayoutCounter() {
        metrics.layoutRun(LayoutOutcome.APPLIED);
        metrics.layoutRun(LayoutOutcome.SKIPPED_CYCLIC);
        metrics.layoutRun(LayoutOutcome.SKIPPED_CYCLIC);

        assertThat(registry.get(EditorMetrics.LAYOUTS).tag("outcome", "SKIPPED_CYCLIC").counter().count())
            .isEqualTo(2.0);
        assertThat(registry.get(EditorMetrics.LAYOUTS).counters()).hasSize(2);
    }

    @Test
    @DisplayName("Rejected connections should be tagged by error code")
    void testRejectionCounter() {
        metrics.connectionRejected("SELF_CONNECTION");
        metrics.connectionRejected("DUPLICATE_CONNECTION");

        assertThat(registry.get(EditorMetrics.CONNECTIONS_REJECTED).tag("error_code", "SELF_CONNECTION")
            .counter().count()).isEqualTo(1.0);
    }
}
