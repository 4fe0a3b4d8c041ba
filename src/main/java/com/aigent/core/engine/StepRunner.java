package com.aigent.core.engine;

import com.aigent.core.agent.Agent;
import com.aigent.core.events.EventBus;
import com.aigent.core.events.OrchestrationEvent;
import com.aigent.core.logging.MdcContext;
import com.aigent.core.metrics.OrchestrationMetrics;
import com.aigent.core.model.ActionResult;
import com.aigent.core.model.WorkflowStep;
import com.aigent.core.plan.PlanNode;
import com.aigent.core.registry.AgentRegistry;
import com.aigent.core.selection.AgentSelector;
import com.aigent.core.selection.NoCandidateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Per-step plumbing shared by all workflow strategies: agent selection, execution,
 * error bookkeeping, MDC, metrics and skip notifications.
 */
@Component
public class StepRunner {

    private static final Logger log = LoggerFactory.getLogger(StepRunner.class);

    private final AgentRegistry registry;
    private final AgentSelector selector;
    private final StepExecutor stepExecutor;
    private final EventBus eventBus;
    private final OrchestrationMetrics metrics;

    public StepRunner(AgentRegistry registry, AgentSelector selector, StepExecutor stepExecutor,
                      EventBus eventBus, @Autowired(required = false) OrchestrationMetrics metrics) {
        this.registry = registry;
        this.selector = selector;
        this.stepExecutor = stepExecutor;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Selects an agent of the step's required type and executes the step.
     * A failed result is recorded as an error on the run; storing the result is up to the caller.
     *
     * @return the step's result, or empty when no agent could be selected (the error is recorded)
     * @throws WorkflowAbortedException if the workflow was cancelled or timed out
     */
    public Optional<ActionResult> run(WorkflowRun run, PlanNode node, Map<String, ActionResult> context) {
        run.control().checkpoint();
        WorkflowStep step = node.step();
        MdcContext.setStep(run.workflowId(), step.name(), null);
        try {
            Agent agent;
            try {
                agent = selector.selectBestAgent(node.taskDescriptor(),
                        registry.agentsOfType(step.requiredAgentType()));
            } catch (NoCandidateException e) {
                String message = noAgentMessage(step);
                log.warn(message);
                run.recordError(message);
                run.stepFinished(false);
                return Optional.empty();
            }

            MdcContext.setStep(run.workflowId(), step.name(), agent.id());
            log.info("Executing step {} with agent {} ({})", step.name(), agent.id(), agent.type());
            long startMs = System.currentTimeMillis();
            ActionResult result = stepExecutor.executeStep(run.workflowId(), agent, step, context, run.control());
            long elapsedMs = System.currentTimeMillis() - startMs;

            if (metrics != null) {
                metrics.recordStepDuration(run.plan().name(), step.name(),
                        result.success() ? "success" : "failure", elapsedMs);
            }
            run.stepFinished(result.success());
            if (result.success()) {
                log.info("Step {} completed in {}ms", step.name(), elapsedMs);
            } else {
                String message = "Error in step " + step.name() + ": " + result.message();
                log.warn(message);
                run.recordError(message);
            }
            return Optional.of(result);
        } finally {
            MdcContext.clearStep();
        }
    }

    /**
     * Returns the first dependency of the node that has not run or did not succeed.
     */
    public Optional<String> unsatisfiedDependency(PlanNode node, Map<String, ActionResult> context) {
        for (String dependency : node.step().dependencies()) {
            ActionResult output = context.get(dependency);
            if (output == null || !output.success()) {
                return Optional.of(dependency);
            }
        }
        return Optional.empty();
    }

    /**
     * Hard-fails a step whose dependency is not satisfied, without calling any agent.
     *
     * @return the failed result standing in for the step
     */
    public ActionResult failUnsatisfied(WorkflowRun run, PlanNode node, String dependency) {
        String message = "Dependency not satisfied for step " + node.name() + ": " + dependency;
        log.warn(message);
        run.recordError(message);
        run.stepFinished(false);
        return ActionResult.failed(message);
    }

    public void skip(WorkflowRun run, PlanNode node, String reason) {
        log.info("Skipping step {}: {}", node.name(), reason);
        if (metrics != null) {
            metrics.recordStepSkipped(run.plan().name());
        }
        try {
            eventBus.publish(OrchestrationEvent.of(OrchestrationEvent.STEP_SKIPPED, run.workflowId(), node.name(),
                    Map.of("step", node.name(), "reason", reason)));
        } catch (Exception e) {
            log.warn("Failed to publish skip of step {}: {}", node.name(), e.getMessage());
        }
    }

    public static String noAgentMessage(WorkflowStep step) {
        return "No agent of type " + step.requiredAgentType() + " available for step " + step.name();
    }
}
