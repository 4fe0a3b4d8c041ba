package com.aigent.core.plan;

import com.aigent.core.model.WorkflowStep;

import java.util.List;

/**
 * A step inside a compiled {@link WorkflowPlan}. Edges are stored as indices into the plan's
 * node list.
 *
 * @param index          position of the step in the definition
 * @param step           the step as declared
 * @param dependencies   indices of the steps this one depends on
 * @param children       indices of the steps that depend on this one, in declaration order
 * @param condition      parsed condition, or null
 * @param taskDescriptor text handed to the agent selector
 */
public record PlanNode(
    int index,
    WorkflowStep step,
    List<Integer> dependencies,
    List<Integer> children,
    StepCondition condition,
    String taskDescriptor
) {

    public String name() {
        return step.name();
    }

    public boolean isRoot() {
        return dependencies.isEmpty();
    }
}
