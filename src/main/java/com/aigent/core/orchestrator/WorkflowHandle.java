package com.aigent.core.orchestrator;

import com.aigent.core.model.WorkflowResult;

import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;

/**
 * Handle to a workflow submitted for asynchronous execution.
 */
public final class WorkflowHandle {

    private final String workflowId;
    private final CompletableFuture<WorkflowResult> result;
    private final BooleanSupplier canceller;

    WorkflowHandle(String workflowId, CompletableFuture<WorkflowResult> result, BooleanSupplier canceller) {
        this.workflowId = workflowId;
        this.result = result;
        this.canceller = canceller;
    }

    public String workflowId() {
        return workflowId;
    }

    /**
     * Completes with the workflow's result, including when it fails, times out or is cancelled.
     */
    public CompletableFuture<WorkflowResult> result() {
        return result;
    }

    /**
     * Requests cancellation. The result future still completes, with state CANCELLED.
     *
     * @return false if the workflow already finished or was already cancelled
     */
    public boolean cancel() {
        return canceller.getAsBoolean();
    }
}
