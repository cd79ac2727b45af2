package com.flowcanvas.engine.coordinator;

import com.flowcanvas.core.history.WorkflowHistory;
import com.flowcanvas.core.model.Workflow;

/**
 * One open workflow: the live aggregate plus its undo history.
 * Callers synchronize on the session while touching it.
 */
class EditorSession {

    private final String name;
    private final WorkflowHistory history;
    private Workflow workflow;
    private boolean dirty;

    EditorSession(String name, Workflow workflow, int historyCapacity) {
        this.name = name;
        this.workflow = workflow;
        this.history = new WorkflowHistory(historyCapacity);
    }

    String name() {
        return name;
    }

    Workflow workflow() {
        return workflow;
    }

    WorkflowHistory history() {
        return history;
    }

    boolean isDirty() {
        return dirty;
    }

    void replace(Workflow restored) {
        this.workflow = restored;
        this.dirty = true;
    }

    void markDirty() {
        this.dirty = true;
    }

    void markSaved() {
        this.dirty = false;
    }
}
