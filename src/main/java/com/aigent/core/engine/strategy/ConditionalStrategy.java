package com.aigent.core.engine.strategy;

import com.aigent.core.engine.StepRunner;
import com.aigent.core.engine.WorkflowRun;
import com.aigent.core.model.ActionResult;
import com.aigent.core.model.StepResult;
import com.aigent.core.model.WorkflowType;
import com.aigent.core.plan.PlanNode;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Walks steps in declared order, running a step only when its dependencies and the step its
 * condition refers to have results and the condition holds. Skipped steps leave no trace in
 * the result; failures do not stop the walk.
 */
@Component
public class ConditionalStrategy implements WorkflowStrategy {

    private final StepRunner runner;

    public ConditionalStrategy(StepRunner runner) {
        this.runner = runner;
    }

    @Override
    public WorkflowType type() {
        return WorkflowType.CONDITIONAL;
    }

    @Override
    public void execute(WorkflowRun run) {
        var context = new LinkedHashMap<String, ActionResult>();
        for (PlanNode node : run.plan().nodes()) {
            run.control().checkpoint();

            String skipReason = skipReason(node, context);
            if (skipReason != null) {
                runner.skip(run, node, skipReason);
                continue;
            }
            runner.run(run, node, context).ifPresent(result -> {
                context.put(node.name(), result);
                run.recordResult(node.name(), StepResult.of(result));
            });
        }
    }

    /**
     * @return why the node must be skipped, or null when it should run
     */
    static String skipReason(PlanNode node, Map<String, ActionResult> context) {
        for (String dependency : node.step().dependencies()) {
            if (!context.containsKey(dependency)) {
                return "dependency " + dependency + " has no result";
            }
        }
        var condition = node.condition();
        if (condition == null) {
            return null;
        }
        var outcome = condition.evaluate(context);
        if (outcome.isEmpty()) {
            return "condition step " + condition.stepName() + " has no result";
        }
        return outcome.get() ? null : "condition '" + condition + "' is false";
    }
}
