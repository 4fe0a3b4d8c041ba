package com.aigent.core.engine;

import com.aigent.core.config.OrchestratorProperties;
import com.aigent.core.engine.strategy.WorkflowStrategy;
import com.aigent.core.events.EventBus;
import com.aigent.core.events.OrchestrationEvent;
import com.aigent.core.logging.MdcContext;
import com.aigent.core.metrics.OrchestrationMetrics;
import com.aigent.core.model.WorkflowDefinition;
import com.aigent.core.model.WorkflowResult;
import com.aigent.core.model.WorkflowState;
import com.aigent.core.model.WorkflowStatus;
import com.aigent.core.model.WorkflowType;
import com.aigent.core.plan.WorkflowConfigurationException;
import com.aigent.core.plan.WorkflowPlan;
import com.aigent.core.plan.WorkflowPlanCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Year;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Compiles workflow definitions and runs them through the strategy registered for their type.
 * <p>
 * Tracks every execution from {@link #prepare} until it finishes; a bounded history of
 * finished executions stays available for status queries.
 */
@Service
public class WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);
    private static final AtomicInteger WORKFLOW_COUNTER = new AtomicInteger(0);

    private final WorkflowPlanCompiler compiler;
    private final Map<WorkflowType, WorkflowStrategy> strategies = new EnumMap<>(WorkflowType.class);
    private final EventBus eventBus;
    private final OrchestratorProperties properties;
    private final OrchestrationMetrics metrics;

    private final ConcurrentHashMap<String, WorkflowRun> active = new ConcurrentHashMap<>();
    private final ConcurrentLinkedDeque<WorkflowRun> history = new ConcurrentLinkedDeque<>();

    public WorkflowEngine(WorkflowPlanCompiler compiler, List<WorkflowStrategy> strategies, EventBus eventBus,
                          OrchestratorProperties properties,
                          @Autowired(required = false) OrchestrationMetrics metrics) {
        this.compiler = compiler;
        this.eventBus = eventBus;
        this.properties = properties;
        this.metrics = metrics;
        for (WorkflowStrategy strategy : strategies) {
            WorkflowStrategy previous = this.strategies.put(strategy.type(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate strategy for workflow type " + strategy.type()
                        + ": " + previous.getClass().getSimpleName() + " and " + strategy.getClass().getSimpleName());
            }
        }
    }

    /**
     * Generates an execution id of the form {@code WF-<year>-<seq>}.
     */
    public String generateWorkflowId() {
        return String.format("WF-%d-%04d", Year.now().getValue(), WORKFLOW_COUNTER.incrementAndGet());
    }

    /**
     * @throws WorkflowConfigurationException if the definition is invalid or its type has no strategy
     */
    public WorkflowPlan compile(WorkflowDefinition definition) {
        WorkflowPlan plan = compiler.compile(definition);
        if (!strategies.containsKey(plan.type())) {
            throw new WorkflowConfigurationException("Unknown workflow type: " + plan.type());
        }
        return plan;
    }

    /**
     * Registers a pending execution so it can be queried and cancelled before it starts.
     *
     * @throws WorkflowConfigurationException if an execution with the same id is still active
     */
    public WorkflowRun prepare(String workflowId, WorkflowPlan plan) {
        if (workflowId == null || workflowId.isBlank()) {
            throw new WorkflowConfigurationException("Workflow id must not be blank");
        }
        int timeout = plan.timeoutSeconds() != null ? plan.timeoutSeconds() : properties.getDefaultTimeoutSeconds();
        var run = new WorkflowRun(workflowId, plan, new ExecutionControl(timeout));
        if (active.putIfAbsent(workflowId, run) != null) {
            throw new WorkflowConfigurationException("Workflow " + workflowId + " is already running");
        }
        return run;
    }

    public WorkflowResult execute(String workflowId, WorkflowDefinition definition) {
        return execute(prepare(workflowId, compile(definition)));
    }

    /**
     * Runs a prepared execution to completion on the calling thread. Never throws for agent or
     * strategy failures, cancellation or timeouts: they are reported through the returned result.
     * Whatever happens, the execution leaves the active set and the logging context is cleared.
     */
    public WorkflowResult execute(WorkflowRun run) {
        WorkflowPlan plan = run.plan();
        MdcContext.setWorkflow(run.workflowId());
        try {
            WorkflowState terminal = WorkflowState.FAILED;
            try {
                run.control().start();
                run.markStarted();
                log.info("Starting {} workflow '{}' with {} steps", plan.type(), plan.name(), plan.size());
                publish(OrchestrationEvent.WORKFLOW_STARTED, run, Map.of(
                        "name", plan.name(),
                        "type", plan.type().name(),
                        "steps", plan.size()));
                terminal = runStrategy(run);
            } finally {
                run.finish(terminal);
                remember(run);
                active.remove(run.workflowId(), run);
            }
            return complete(run, terminal);
        } finally {
            MdcContext.clear();
        }
    }

    private WorkflowState runStrategy(WorkflowRun run) {
        WorkflowPlan plan = run.plan();
        try {
            run.control().checkpoint();
            strategies.get(plan.type()).execute(run);
            return run.hasErrors() ? WorkflowState.FAILED : WorkflowState.COMPLETED;
        } catch (WorkflowAbortedException e) {
            log.warn("Workflow '{}' aborted: {}", plan.name(), e.getMessage());
            run.recordError(e.getMessage());
            return e.state();
        } catch (OutOfMemoryError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            log.error("Workflow '{}' failed unexpectedly: {}", plan.name(), e.getMessage(), e);
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            run.recordError("Workflow failed: " + reason);
            return WorkflowState.FAILED;
        }
    }

    private WorkflowResult complete(WorkflowRun run, WorkflowState terminal) {
        WorkflowPlan plan = run.plan();
        WorkflowResult result = run.toResult();
        if (metrics != null) {
            metrics.recordWorkflowResult(plan.type().name(), terminal.name());
            metrics.recordWorkflowDuration(plan.name(), result.durationMs());
        }
        log.info("Workflow '{}' finished as {} in {}ms ({} results, {} errors)", plan.name(), terminal,
                result.durationMs(), result.results().size(), result.errors().size());

        var payload = new HashMap<String, Object>();
        payload.put("name", plan.name());
        payload.put("state", terminal.name());
        payload.put("success", result.success());
        payload.put("errors", result.errors());
        payload.put("durationMs", result.durationMs());
        publish(terminal == WorkflowState.COMPLETED
                ? OrchestrationEvent.WORKFLOW_COMPLETED : OrchestrationEvent.WORKFLOW_FAILED, run, payload);
        return result;
    }

    /**
     * Requests cancellation of an active execution.
     *
     * @return false if no active execution has that id or it was already cancelled
     */
    public boolean cancel(String workflowId) {
        WorkflowRun run = workflowId != null ? active.get(workflowId) : null;
        if (run == null) {
            log.warn("Cannot cancel workflow {}: not running", workflowId);
            return false;
        }
        boolean cancelled = run.control().cancel();
        if (cancelled) {
            log.info("Cancellation requested for workflow {}", workflowId);
        }
        return cancelled;
    }

    public Optional<WorkflowStatus> status(String workflowId) {
        if (workflowId == null) {
            return Optional.empty();
        }
        WorkflowRun run = active.get(workflowId);
        if (run != null) {
            return Optional.of(run.status());
        }
        for (WorkflowRun finished : history) {
            if (finished.workflowId().equals(workflowId)) {
                return Optional.of(finished.status());
            }
        }
        return Optional.empty();
    }

    /**
     * Status of every execution that is pending or running, oldest id first.
     */
    public List<WorkflowStatus> running() {
        var statuses = new ArrayList<WorkflowStatus>();
        for (WorkflowRun run : active.values()) {
            statuses.add(run.status());
        }
        statuses.sort(Comparator.comparing(WorkflowStatus::workflowId));
        return statuses;
    }

    private void remember(WorkflowRun run) {
        history.addFirst(run);
        int limit = Math.max(0, properties.getHistorySize());
        while (history.size() > limit) {
            history.pollLast();
        }
    }

    private void publish(String eventType, WorkflowRun run, Map<String, Object> payload) {
        try {
            eventBus.publish(OrchestrationEvent.of(eventType, run.workflowId(), null, payload));
        } catch (Exception e) {
            log.warn("Failed to publish {} for workflow {}: {}", eventType, run.workflowId(), e.getMessage());
        }
    }
}
