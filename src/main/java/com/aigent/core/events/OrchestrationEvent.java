package com.aigent.core.events;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * An event emitted by the orchestrator, used for CLI watch mode and external observers.
 *
 * @param eventType  event type (e.g. "workflow.started", "workflow.step.completed", "agent.registered")
 * @param workflowId the workflow this event belongs to (nullable for agent lifecycle events)
 * @param stepName   the step this event relates to (nullable for workflow-level events)
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record OrchestrationEvent(
    String eventType,
    String workflowId,
    String stepName,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static final String WORKFLOW_STARTED = "workflow.started";
    public static final String WORKFLOW_COMPLETED = "workflow.completed";
    public static final String WORKFLOW_FAILED = "workflow.failed";
    public static final String STEP_COMPLETED = "workflow.step.completed";
    public static final String STEP_SKIPPED = "workflow.step.skipped";
    public static final String AGENT_REGISTERED = "agent.registered";
    public static final String AGENT_UNREGISTERED = "agent.unregistered";

    /** Types published while a workflow executes. */
    public static final Set<String> WORKFLOW_EVENT_TYPES =
            Set.of(WORKFLOW_STARTED, WORKFLOW_COMPLETED, WORKFLOW_FAILED, STEP_COMPLETED, STEP_SKIPPED);

    public OrchestrationEvent {
        payload = payload == null ? Map.of() : payload;
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static OrchestrationEvent of(String eventType, String workflowId, String stepName,
                                        Map<String, Object> payload) {
        return new OrchestrationEvent(eventType, workflowId, stepName, payload, Instant.now());
    }
}
