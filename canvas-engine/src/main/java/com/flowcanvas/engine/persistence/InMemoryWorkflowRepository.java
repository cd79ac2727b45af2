package com.flowcanvas.engine.persistence;

import com.flowcanvas.core.codec.WorkflowCodec;
import com.flowcanvas.core.model.Workflow;
import com.flowcanvas.core.repository.WorkflowRepository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of WorkflowRepository.
 * Holds encoded JSON documents, so every load goes through the codec and returns a fresh copy.
 */
public class InMemoryWorkflowRepository implements WorkflowRepository {

    // Key: workflow name, value: JSON document
    private final Map<String, String> documents = new ConcurrentHashMap<>();

    private final WorkflowCodec codec;

    public InMemoryWorkflowRepository(WorkflowCodec codec) {
        this.codec = codec;
    }

    @Override
    public void save(String name, Workflow workflow) {
        documents.put(name, codec.encode(workflow));
    }

    @Override
    public Optional<Workflow> find(String name) {
        return Optional.ofNullable(documents.get(name)).map(codec::decode);
    }

    @Override
    public List<String> listNames() {
        return documents.keySet().stream().sorted().toList();
    }

    @Override
    public boolean delete(String name) {
        return documents.remove(name) != null;
    }

    @Override
    public boolean exists(String name) {
        return documents.containsKey(name);
    }
}
