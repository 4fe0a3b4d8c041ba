package com.aigent.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Recorded outcome of a step, keyed by step name in {@link WorkflowResult#results()}.
 * <p>
 * For HIERARCHICAL workflows the entry stored under a root aggregates the whole subtree:
 * {@code children} holds each child step's own {@code StepResult}, recursively.
 * Flat workflows always have empty children.
 *
 * @param result   the step's own action result
 * @param children child step name to child outcome, in execution order
 */
public record StepResult(
    ActionResult result,
    Map<String, StepResult> children
) {

    public StepResult {
        children = children == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(children));
    }

    public static StepResult of(ActionResult result) {
        return new StepResult(result, Map.of());
    }

    /**
     * True only if this step and every descendant succeeded.
     */
    public boolean succeeded() {
        if (result == null || !result.success()) {
            return false;
        }
        return children.values().stream().allMatch(StepResult::succeeded);
    }

    /**
     * Looks up a descendant (or this step's direct child) by name, depth first.
     */
    public StepResult find(String stepName) {
        StepResult direct = children.get(stepName);
        if (direct != null) {
            return direct;
        }
        for (var child : children.values()) {
            StepResult nested = child.find(stepName);
            if (nested != null) {
                return nested;
            }
        }
        return null;
    }
}
