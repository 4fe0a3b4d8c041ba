package com.aigent.core.engine.strategy;

import com.aigent.core.engine.StepRunner;
import com.aigent.core.engine.WorkflowRun;
import com.aigent.core.model.ActionResult;
import com.aigent.core.model.StepResult;
import com.aigent.core.model.WorkflowType;
import com.aigent.core.plan.PlanNode;
import com.aigent.core.plan.WorkflowPlan;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Walks the dependency tree depth first from each root, in declared root order.
 * <p>
 * A child is visited once all of its parents have completed, so a step with several parents
 * runs exactly once, nested under the parent that completed last. Each root's aggregate
 * {@link StepResult} is recorded under the root's name.
 */
@Component
public class HierarchicalStrategy implements WorkflowStrategy {

    private final StepRunner runner;

    public HierarchicalStrategy(StepRunner runner) {
        this.runner = runner;
    }

    @Override
    public WorkflowType type() {
        return WorkflowType.HIERARCHICAL;
    }

    @Override
    public void execute(WorkflowRun run) {
        WorkflowPlan plan = run.plan();
        int[] pendingParents = new int[plan.size()];
        for (PlanNode node : plan.nodes()) {
            pendingParents[node.index()] = node.dependencies().size();
        }
        var context = new LinkedHashMap<String, ActionResult>();
        for (int root : plan.roots()) {
            PlanNode node = plan.node(root);
            run.recordResult(node.name(), visit(run, node, context, pendingParents));
        }
    }

    private StepResult visit(WorkflowRun run, PlanNode node, Map<String, ActionResult> context,
                             int[] pendingParents) {
        run.control().checkpoint();

        ActionResult own;
        Optional<String> missing = runner.unsatisfiedDependency(node, context);
        if (missing.isPresent()) {
            own = runner.failUnsatisfied(run, node, missing.get());
        } else {
            own = runner.run(run, node, context)
                    .orElseGet(() -> ActionResult.failed(StepRunner.noAgentMessage(node.step())));
        }
        context.put(node.name(), own);

        var children = new LinkedHashMap<String, StepResult>();
        WorkflowPlan plan = run.plan();
        for (int childIndex : node.children()) {
            if (--pendingParents[childIndex] == 0) {
                PlanNode child = plan.node(childIndex);
                children.put(child.name(), visit(run, child, context, pendingParents));
            }
        }
        return new StepResult(own, children);
    }
}
