package com.aigent.core.engine;

import com.aigent.core.model.WorkflowState;

/**
 * Raised at a checkpoint once a workflow has been cancelled or has run past its deadline.
 * The engine turns it into a terminal {@link WorkflowState}; it never leaves the engine.
 */
public class WorkflowAbortedException extends RuntimeException {

    private final WorkflowState state;

    public WorkflowAbortedException(WorkflowState state, String message) {
        super(message);
        this.state = state;
    }

    public WorkflowState state() {
        return state;
    }
}
