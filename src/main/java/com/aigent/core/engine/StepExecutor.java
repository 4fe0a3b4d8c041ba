package com.aigent.core.engine;

import com.aigent.core.agent.Agent;
import com.aigent.core.config.OrchestratorProperties;
import com.aigent.core.events.EventBus;
import com.aigent.core.events.OrchestrationEvent;
import com.aigent.core.model.Action;
import com.aigent.core.model.ActionResult;
import com.aigent.core.model.EnvironmentState;
import com.aigent.core.model.WorkflowStep;
import com.aigent.core.safety.SafetyValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a single workflow step against an already selected agent.
 * <p>
 * Builds the environment snapshot from the step parameters plus {@code dep_<name>} entries for
 * dependencies found in the context, lets the agent decide, optionally vets the action, executes
 * it and publishes {@code workflow.step.completed}. Agent failures of any kind, errors such as
 * {@link AssertionError} included, come back as a failed {@link ActionResult}; only a cancelled
 * or expired workflow escapes as {@link WorkflowAbortedException}, and {@link OutOfMemoryError}
 * is never swallowed.
 * <p>
 * Without a step or workflow deadline the agent is called on the current thread. Otherwise each
 * call runs on the worker pool and the wait is bounded by the earliest deadline.
 */
@Service
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    private final ExecutorService executor;
    private final EventBus eventBus;
    private final OrchestratorProperties properties;
    private final SafetyValidator safetyValidator;

    public StepExecutor(ExecutorService executor, EventBus eventBus, OrchestratorProperties properties,
                        @Autowired(required = false) SafetyValidator safetyValidator) {
        this.executor = executor;
        this.eventBus = eventBus;
        this.properties = properties;
        this.safetyValidator = safetyValidator;
    }

    public ActionResult executeStep(String workflowId, Agent agent, WorkflowStep step,
                                    Map<String, ActionResult> context, ExecutionControl control) {
        var state = snapshot(step, context);
        int stepTimeout = stepTimeoutSeconds(step);
        long stepDeadline = stepTimeout > 0 ? System.nanoTime() + TimeUnit.SECONDS.toNanos(stepTimeout) : 0L;

        Action action = null;
        ActionResult result;
        try {
            control.checkpoint();
            action = call(() -> agent.decideAction(state), stepDeadline, control);
            if (action == null) {
                result = ActionResult.failed("Agent " + agent.id() + " decided no action for step " + step.name());
            } else {
                result = vet(agent, action);
                if (result == null) {
                    control.checkpoint();
                    final Action decided = action;
                    result = call(() -> agent.execute(decided), stepDeadline, control);
                    if (result == null) {
                        result = ActionResult.failed(
                                "Agent " + agent.id() + " returned no result for step " + step.name());
                    }
                }
            }
        } catch (WorkflowAbortedException e) {
            throw e;
        } catch (StepTimeoutException e) {
            result = ActionResult.failed("Step " + step.name() + " timed out after " + stepTimeout + " seconds");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = ActionResult.failed("Step " + step.name() + " interrupted");
        } catch (OutOfMemoryError e) {
            throw e;
        } catch (Exception | Error e) {
            log.debug("Agent {} failed on step {}", agent.id(), step.name(), e);
            result = ActionResult.failed(messageOf(e));
        }

        publishCompleted(workflowId, agent, step, action, result);
        return result;
    }

    EnvironmentState snapshot(WorkflowStep step, Map<String, ActionResult> context) {
        var props = new LinkedHashMap<String, Object>(step.parameters());
        for (String dependency : step.dependencies()) {
            ActionResult output = context.get(dependency);
            if (output != null) {
                props.put(EnvironmentState.DEPENDENCY_PREFIX + dependency, output);
            }
        }
        return EnvironmentState.of(props);
    }

    private int stepTimeoutSeconds(WorkflowStep step) {
        return step.timeoutSeconds() != null ? step.timeoutSeconds() : properties.getDefaultStepTimeoutSeconds();
    }

    /**
     * @return null when the action may run, otherwise the failed result replacing it
     */
    private ActionResult vet(Agent agent, Action action) {
        if (safetyValidator == null) {
            return null;
        }
        var verdict = safetyValidator.validate(agent, action);
        if (verdict == null || verdict.valid()) {
            return null;
        }
        log.warn("Safety validator rejected action {} of agent {}: {}", action.type(), agent.id(), verdict.message());
        return ActionResult.failed("Action rejected by safety validator: " + verdict.message());
    }

    private <T> T call(Callable<T> agentCall, long stepDeadline, ExecutionControl control) throws Exception {
        if (stepDeadline == 0L && !control.hasDeadline()) {
            return agentCall.call();
        }
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<T> future = executor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return agentCall.call();
            } finally {
                MDC.clear();
            }
        });
        control.track(future);
        try {
            long stepRemaining = stepDeadline == 0L ? Long.MAX_VALUE : stepDeadline - System.nanoTime();
            long wait = Math.max(0L, Math.min(stepRemaining, control.remainingNanos()));
            return future.get(wait, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            control.checkpoint();
            throw new StepTimeoutException();
        } catch (CancellationException e) {
            control.checkpoint();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } finally {
            control.untrack(future);
        }
    }

    private void publishCompleted(String workflowId, Agent agent, WorkflowStep step, Action action,
                                  ActionResult result) {
        var payload = new HashMap<String, Object>();
        payload.put("step", step.name());
        payload.put("agentId", agent.id());
        if (action != null) {
            payload.put("action", action);
        }
        payload.put("success", result.success());
        payload.put("result", result);
        if (result.message() != null) {
            payload.put("message", result.message());
        }
        try {
            eventBus.publish(OrchestrationEvent.of(OrchestrationEvent.STEP_COMPLETED, workflowId, step.name(), payload));
        } catch (Exception e) {
            log.warn("Failed to publish completion of step {}: {}", step.name(), e.getMessage());
        }
    }

    private static String messageOf(Throwable e) {
        String message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
    }

    private static final class StepTimeoutException extends Exception {
        StepTimeoutException() {
            super(null, null, false, false);
        }
    }
}
