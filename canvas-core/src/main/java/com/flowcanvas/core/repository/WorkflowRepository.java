package com.flowcanvas.core.repository;

import com.flowcanvas.core.model.Workflow;

import java.util.List;
import java.util.Optional;

/**
 * Repository for named workflow documents.
 * Implementations store independent copies: mutating a saved or loaded workflow never
 * changes what the repository holds.
 */
public interface WorkflowRepository {

    /**
     * Save a workflow under the given name, replacing any previous version.
     */
    void save(String name, Workflow workflow);

    Optional<Workflow> find(String name);

    /**
     * Names of all stored workflows, sorted.
     */
    List<String> listNames();

    /**
     * @return true if a workflow was removed
     */
    boolean delete(String name);

    boolean exists(String name);
}
