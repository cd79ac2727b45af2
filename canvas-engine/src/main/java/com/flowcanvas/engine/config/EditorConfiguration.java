package com.flowcanvas.engine.config;

import com.flowcanvas.core.codec.WorkflowCodec;
import com.flowcanvas.core.graph.DagLayout;
import com.flowcanvas.core.repository.WorkflowRepository;
import com.flowcanvas.engine.coordinator.WorkflowEditorCoordinator;
import com.flowcanvas.engine.metrics.EditorMetrics;
import com.flowcanvas.engine.persistence.InMemoryWorkflowRepository;
import com.flowcanvas.engine.service.WorkflowEditorService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

/**
 * Spring wiring for the editor.
 *
 * Configures:
 * - editor settings from canvas-editor.properties
 * - codec, layout and in-memory repository
 * - metrics bound to a simple registry, tagged with the application name
 * - the editor service
 */
@Configuration
@PropertySource("classpath:canvas-editor.properties")
public class EditorConfiguration {

    @Bean
    public EditorSettings editorSettings(
            @Value("${canvas.editor.layer-spacing:140}") double layerSpacing,
            @Value("${canvas.editor.node-spacing:60}") double nodeSpacing,
            @Value("${canvas.editor.history-capacity:60}") int historyCapacity,
            @Value("${canvas.editor.fit-padding:180}") double fitPadding) {
        return new EditorSettings(layerSpacing, nodeSpacing, historyCapacity, fitPadding);
    }

    @Bean
    public WorkflowCodec workflowCodec() {
        return new WorkflowCodec();
    }

    @Bean
    public DagLayout dagLayout(EditorSettings settings) {
        return settings.layout();
    }

    @Bean
    public WorkflowRepository workflowRepository(WorkflowCodec codec) {
        return new InMemoryWorkflowRepository(codec);
    }

    @Bean
    public MeterRegistry meterRegistry() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        registry.config().commonTags("application", "flow-canvas-editor");
        return registry;
    }

    @Bean
    public EditorMetrics editorMetrics(MeterRegistry registry) {
        EditorMetrics metrics = new EditorMetrics();
        metrics.bindTo(registry);
        return metrics;
    }

    @Bean
    public WorkflowEditorService workflowEditorService(
            WorkflowRepository repository,
            DagLayout layout,
            EditorMetrics metrics,
            EditorSettings settings) {
        return new WorkflowEditorCoordinator(repository, layout, metrics, settings);
    }
}
