package com.flowcanvas.core.history;

import com.flowcanvas.core.model.Workflow;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Bounded undo/redo stacks of deep workflow snapshots.
 *
 * Saving an undo point clears the redo stack. When the undo stack exceeds its capacity the
 * oldest snapshot is dropped.
 */
public class WorkflowHistory {

    public static final int DEFAULT_CAPACITY = 60;

    private final int capacity;
    private final Deque<Workflow> undoStack = new ArrayDeque<>();
    private final Deque<Workflow> redoStack = new ArrayDeque<>();

    public WorkflowHistory() {
        this(DEFAULT_CAPACITY);
    }

    public WorkflowHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
    }

    /**
     * Record the state before a mutation.
     */
    public void saveUndoPoint(Workflow current) {
        undoStack.push(current.copy());
        while (undoStack.size() > capacity) {
            undoStack.removeLast();
        }
        redoStack.clear();
    }

    /**
     * Step back one snapshot. The current state moves onto the redo stack.
     *
     * @return the state to restore, empty if there is nothing to undo
     */
    public Optional<Workflow> undo(Workflow current) {
        if (undoStack.isEmpty()) {
            return Optional.empty();
        }
        redoStack.push(current.copy());
        return Optional.of(undoStack.pop());
    }

    /**
     * Re-apply the last undone snapshot. The current state moves back onto the undo stack.
     *
     * @return the state to restore, empty if there is nothing to redo
     */
    public Optional<Workflow> redo(Workflow current) {
        if (redoStack.isEmpty()) {
            return Optional.empty();
        }
        undoStack.push(current.copy());
        while (undoStack.size() > capacity) {
            undoStack.removeLast();
        }
        return Optional.of(redoStack.pop());
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    public int undoDepth() {
        return undoStack.size();
    }

    public int redoDepth() {
        return redoStack.size();
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        undoStack.clear();
        redoStack.clear();
    }
}
