package com.aigent.core.engine.strategy;

import com.aigent.core.engine.WorkflowRun;
import com.aigent.core.model.WorkflowType;

/**
 * Executes the steps of a compiled plan for one {@link WorkflowType}.
 * Implementations record results and errors on the run and let
 * {@link com.aigent.core.engine.WorkflowAbortedException} propagate.
 */
public interface WorkflowStrategy {

    WorkflowType type();

    void execute(WorkflowRun run);
}
