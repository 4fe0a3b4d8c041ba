package com.aigent.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A multi-step workflow submitted to the orchestrator.
 *
 * @param name           human identifier (not required to be unique)
 * @param type           execution strategy
 * @param steps          ordered steps; order matters for SEQUENTIAL and CONDITIONAL only
 * @param timeoutSeconds overall deadline overriding the configured default; nullable, 0 = none
 */
public record WorkflowDefinition(
    String name,
    WorkflowType type,
    List<WorkflowStep> steps,
    Integer timeoutSeconds
) {

    public WorkflowDefinition {
        // null entries are kept so the plan compiler can report them by position
        steps = steps == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public static WorkflowDefinition of(String name, WorkflowType type, WorkflowStep... steps) {
        return new WorkflowDefinition(name, type, Arrays.asList(steps), null);
    }

    public WorkflowDefinition withTimeoutSeconds(Integer seconds) {
        return new WorkflowDefinition(name, type, steps, seconds);
    }
}
