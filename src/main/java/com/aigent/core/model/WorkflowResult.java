package com.aigent.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured answer returned for every workflow execution, including partial failures.
 *
 * @param workflowId   execution id (e.g. "WF-2026-0001")
 * @param workflowName name from the definition
 * @param success      true iff no error was recorded
 * @param results      step name to recorded outcome; skipped steps are absent
 * @param errors       one human-readable message per failed step, each naming the step
 * @param state        terminal state of the execution
 * @param durationMs   wall-clock duration
 */
public record WorkflowResult(
    String workflowId,
    String workflowName,
    boolean success,
    Map<String, StepResult> results,
    List<String> errors,
    WorkflowState state,
    long durationMs
) {

    public WorkflowResult {
        results = results == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(results));
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * Convenience accessor for the action result recorded under a top-level step name.
     */
    public ActionResult actionResult(String stepName) {
        StepResult step = results.get(stepName);
        return step != null ? step.result() : null;
    }
}
