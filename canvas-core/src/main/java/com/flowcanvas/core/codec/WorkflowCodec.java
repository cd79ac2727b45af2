package com.flowcanvas.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.flowcanvas.core.exception.InvalidWorkflowDocumentException;
import com.flowcanvas.core.model.Node;
import com.flowcanvas.core.model.NodeId;
import com.flowcanvas.core.model.Workflow;

import java.util.HashSet;
import java.util.Set;

/**
 * JSON encoding of workflows.
 *
 * Decoding restores the stored graph as-is; it does not re-run the connection checks, so a
 * document with a cycle loads and is reported later by layout and validation.
 */
public class WorkflowCodec {

    private final ObjectMapper objectMapper;

    public WorkflowCodec() {
        this(defaultObjectMapper());
    }

    public WorkflowCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    public String encode(Workflow workflow) {
        try {
            return objectMapper.writeValueAsString(WorkflowDocument.from(workflow));
        } catch (JsonProcessingException e) {
            throw new InvalidWorkflowDocumentException("Failed to encode workflow", e);
        }
    }

    public String encodePretty(Workflow workflow) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter()
                .writeValueAsString(WorkflowDocument.from(workflow));
        } catch (JsonProcessingException e) {
            throw new InvalidWorkflowDocumentException("Failed to encode workflow", e);
        }
    }

    /**
     * @throws InvalidWorkflowDocumentException if the text is not a workflow document, a position
     *         is not finite, or two nodes share an id
     */
    public Workflow decode(String json) {
        WorkflowDocument document;
        try {
            document = objectMapper.readValue(json, WorkflowDocument.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InvalidWorkflowDocumentException("Malformed workflow document: " + e.getMessage(), e);
        }
        if (document == null) {
            throw new InvalidWorkflowDocumentException("Empty workflow document");
        }
        checkNodes(document);
        return document.toWorkflow();
    }

    private static void checkNodes(WorkflowDocument document) {
        if (document.nodes() == null) {
            return;
        }
        Set<NodeId> seen = new HashSet<>();
        for (Node node : document.nodes()) {
            if (node == null) {
                throw new InvalidWorkflowDocumentException("Null node in workflow document");
            }
            if (!Double.isFinite(node.x()) || !Double.isFinite(node.y())) {
                throw new InvalidWorkflowDocumentException("Node " + node.id() + " has a non-finite position");
            }
            if (!seen.add(node.id())) {
                throw new InvalidWorkflowDocumentException("Duplicate node id " + node.id());
            }
        }
    }
}
