package com.aigent.core.model;

import java.time.Instant;

/**
 * Point-in-time view of a workflow execution, used for lifecycle tracking.
 *
 * @param workflowId     execution id
 * @param workflowName   name from the definition
 * @param type           execution strategy
 * @param state          current lifecycle state
 * @param totalSteps     number of steps in the definition
 * @param completedSteps steps that produced a result or a recorded failure so far
 * @param failedSteps    steps that failed so far
 * @param startedAt      when execution started (nullable while pending)
 * @param finishedAt     when execution reached a terminal state (nullable while running)
 */
public record WorkflowStatus(
    String workflowId,
    String workflowName,
    WorkflowType type,
    WorkflowState state,
    int totalSteps,
    int completedSteps,
    int failedSteps,
    Instant startedAt,
    Instant finishedAt
) {}
