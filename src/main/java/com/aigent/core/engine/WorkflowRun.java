package com.aigent.core.engine;

import com.aigent.core.model.StepResult;
import com.aigent.core.model.WorkflowResult;
import com.aigent.core.model.WorkflowState;
import com.aigent.core.model.WorkflowStatus;
import com.aigent.core.plan.WorkflowPlan;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mutable state of one workflow execution: recorded results, errors and lifecycle.
 * Result and error collections are safe for concurrent writers (PARALLEL workflows).
 */
public class WorkflowRun {

    private final String workflowId;
    private final WorkflowPlan plan;
    private final ExecutionControl control;

    private final Map<String, StepResult> results = Collections.synchronizedMap(new LinkedHashMap<>());
    private final List<String> errors = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger completedSteps = new AtomicInteger();
    private final AtomicInteger failedSteps = new AtomicInteger();

    private volatile WorkflowState state = WorkflowState.PENDING;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    public WorkflowRun(String workflowId, WorkflowPlan plan, ExecutionControl control) {
        this.workflowId = workflowId;
        this.plan = plan;
        this.control = control;
    }

    public String workflowId() {
        return workflowId;
    }

    public WorkflowPlan plan() {
        return plan;
    }

    public ExecutionControl control() {
        return control;
    }

    public WorkflowState state() {
        return state;
    }

    public void recordResult(String stepName, StepResult result) {
        results.put(stepName, result);
    }

    public void recordError(String message) {
        errors.add(message);
    }

    /** Counts a step that produced a result or a recorded failure. */
    public void stepFinished(boolean success) {
        completedSteps.incrementAndGet();
        if (!success) {
            failedSteps.incrementAndGet();
        }
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    void markStarted() {
        startedAt = Instant.now();
        state = WorkflowState.RUNNING;
    }

    void finish(WorkflowState terminal) {
        finishedAt = Instant.now();
        state = terminal;
    }

    long durationMs() {
        if (startedAt == null) {
            return 0L;
        }
        Instant end = finishedAt != null ? finishedAt : Instant.now();
        return Duration.between(startedAt, end).toMillis();
    }

    public WorkflowResult toResult() {
        Map<String, StepResult> resultCopy;
        synchronized (results) {
            resultCopy = new LinkedHashMap<>(results);
        }
        List<String> errorCopy;
        synchronized (errors) {
            errorCopy = new ArrayList<>(errors);
        }
        return new WorkflowResult(workflowId, plan.name(), errorCopy.isEmpty(), resultCopy, errorCopy,
                state, durationMs());
    }

    public WorkflowStatus status() {
        return new WorkflowStatus(workflowId, plan.name(), plan.type(), state, plan.size(),
                completedSteps.get(), failedSteps.get(), startedAt, finishedAt);
    }
}
