package com.aigent.core.engine.strategy;

import com.aigent.core.engine.StepRunner;
import com.aigent.core.engine.WorkflowRun;
import com.aigent.core.model.ActionResult;
import com.aigent.core.model.StepResult;
import com.aigent.core.model.WorkflowType;
import com.aigent.core.plan.PlanNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Optional;

/**
 * Runs steps one after another in declared order and stops at the first failure.
 */
@Component
public class SequentialStrategy implements WorkflowStrategy {

    private static final Logger log = LoggerFactory.getLogger(SequentialStrategy.class);

    private final StepRunner runner;

    public SequentialStrategy(StepRunner runner) {
        this.runner = runner;
    }

    @Override
    public WorkflowType type() {
        return WorkflowType.SEQUENTIAL;
    }

    @Override
    public void execute(WorkflowRun run) {
        var context = new LinkedHashMap<String, ActionResult>();
        for (PlanNode node : run.plan().nodes()) {
            run.control().checkpoint();

            Optional<String> missing = runner.unsatisfiedDependency(node, context);
            if (missing.isPresent()) {
                runner.failUnsatisfied(run, node, missing.get());
                stop(node);
                return;
            }

            Optional<ActionResult> result = runner.run(run, node, context);
            if (result.isEmpty()) {
                stop(node);
                return;
            }
            context.put(node.name(), result.get());
            run.recordResult(node.name(), StepResult.of(result.get()));
            if (!result.get().success()) {
                stop(node);
                return;
            }
        }
    }

    private void stop(PlanNode node) {
        log.info("Stopping sequential workflow after failure in step {}", node.name());
    }
}
