package com.flowcanvas.engine.config;

import com.flowcanvas.core.graph.DagLayout;
import com.flowcanvas.core.repository.WorkflowRepository;
import com.flowcanvas.engine.metrics.EditorMetrics;
import com.flowcanvas.engine.service.WorkflowEditorService;
import com.flowcanvas.engine.service.WorkflowEditorService.AddNodeRequest;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Editor Configuration Tests")
public class EditorConfigurationTest {

    @Test
    @DisplayName("Settings should be read from canvas-editor.properties")
    void testSettingsFromProperties() {
        try (var context = new AnnotationConfigApplicationContext(EditorConfiguration.class)) {
            EditorSettings settings = context.getBean(EditorSettings.class);

            assertThat(settings).isEqualTo(EditorSettings.defaults());
            assertThat(settings.layerSpacing()).isEqualTo(140.0);
            assertThat(settings.nodeSpacing()).isEqualTo(60.0);
            assertThat(settings.historyCapacity()).isEqualTo(60);
            assertThat(settings.fitPadding()).isEqualTo(180.0);
        }
    }

    @Test
    @DisplayName("Context should wire a working editor service")
    void testServiceWiring() {
        try (var context = new AnnotationConfigApplicationContext(EditorConfiguration.class)) {
            WorkflowEditorService editor = context.getBean(WorkflowEditorService.class);
            MeterRegistry registry = context.getBean(MeterRegistry.class);

            editor.createWorkflow("wired");
            editor.addNode("wired", AddNodeRequest.at("run", 0.0, 0.0));
            editor.saveWorkflow("wired");

            assertThat(context.getBean(WorkflowRepository.class).exists("wired")).isTrue();
            assertThat(context.getBean(DagLayout.class).layerSpacing()).isEqualTo(140.0);
            assertThat(context.getBean(EditorMetrics.class).getOpenSessions()).isEqualTo(1);
            assertThat(registry.get(EditorMetrics.NODES_ADDED).tag("application", "flow-canvas-editor")
                .counter().count()).isEqualTo(1.0);
        }
    }

    @Test
    @DisplayName("Invalid settings should be rejected")
    void testInvalidSettings() {
        assertThatThrownBy(() -> new EditorSettings(140.0, 60.0, 0, 180.0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EditorSettings(140.0, 60.0, 60, -1.0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new EditorSettings(-140.0, 60.0, 60, 180.0).layout())
            .isInstanceOf(IllegalArgumentException.class);
    }
}
