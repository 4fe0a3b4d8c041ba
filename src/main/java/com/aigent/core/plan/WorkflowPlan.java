package com.aigent.core.plan;

import com.aigent.core.model.WorkflowType;

import java.util.List;

/**
 * A validated workflow definition, compiled once before execution.
 *
 * @param name             workflow name
 * @param type             execution strategy
 * @param timeoutSeconds   overall deadline from the definition; null to use the configured default
 * @param nodes            steps in declaration order
 * @param roots            indices of steps without dependencies, in declaration order
 * @param topologicalOrder indices in an order where every step follows its dependencies
 */
public record WorkflowPlan(
    String name,
    WorkflowType type,
    Integer timeoutSeconds,
    List<PlanNode> nodes,
    List<Integer> roots,
    List<Integer> topologicalOrder
) {

    public PlanNode node(int index) {
        return nodes.get(index);
    }

    public int size() {
        return nodes.size();
    }
}
