package com.aigent.core.model;

/**
 * Lifecycle state of a workflow execution.
 */
public enum WorkflowState {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }
}
