package com.aigent.core.orchestrator;

import com.aigent.core.agent.Agent;
import com.aigent.core.engine.WorkflowEngine;
import com.aigent.core.engine.WorkflowRun;
import com.aigent.core.events.EventBus;
import com.aigent.core.events.OrchestrationEvent;
import com.aigent.core.metrics.OrchestrationMetrics;
import com.aigent.core.model.WorkflowDefinition;
import com.aigent.core.model.WorkflowResult;
import com.aigent.core.model.WorkflowStatus;
import com.aigent.core.plan.WorkflowPlan;
import com.aigent.core.registry.AgentRegistry;
import com.aigent.core.selection.AgentSelector;
import com.aigent.core.selection.NoCandidateException;
import com.aigent.core.selection.ScoredAgent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Entry point for callers: agent registration, ad-hoc task assignment and workflow execution.
 * <p>
 * Only {@link com.aigent.core.plan.WorkflowConfigurationException} (invalid definitions) and
 * {@link NoCandidateException} (task assignment without agents) leave this class; every
 * runtime failure inside a workflow is reported through its {@link WorkflowResult}.
 */
@Service
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final AgentRegistry registry;
    private final AgentSelector selector;
    private final WorkflowEngine engine;
    private final EventBus eventBus;
    private final ExecutorService executor;
    private final OrchestrationMetrics metrics;

    public Orchestrator(AgentRegistry registry, AgentSelector selector, WorkflowEngine engine, EventBus eventBus,
                        ExecutorService executor, @Autowired(required = false) OrchestrationMetrics metrics) {
        this.registry = registry;
        this.selector = selector;
        this.engine = engine;
        this.eventBus = eventBus;
        this.executor = executor;
        this.metrics = metrics;
        if (metrics != null) {
            metrics.bindRegisteredAgents(registry::size);
        }
    }

    public void registerAgent(Agent agent) {
        Optional<Agent> previous = registry.register(agent);
        log.info("Registered agent {} ({}, {}){}", agent.id(), agent.name(), agent.type(),
                previous.isPresent() ? ", replacing previous instance" : "");
        var payload = new HashMap<String, Object>();
        payload.put("agentId", agent.id());
        payload.put("name", agent.name());
        payload.put("type", String.valueOf(agent.type()));
        payload.put("replaced", previous.isPresent());
        publish(OrchestrationEvent.AGENT_REGISTERED, payload);
    }

    /**
     * @return false if no agent was registered under that id
     */
    public boolean unregisterAgent(String agentId) {
        boolean removed = registry.unregister(agentId);
        if (removed) {
            log.info("Unregistered agent {}", agentId);
            publish(OrchestrationEvent.AGENT_UNREGISTERED, Map.of("agentId", agentId));
        }
        return removed;
    }

    public List<Agent> agents() {
        return registry.all();
    }

    /**
     * Picks the best registered agent of any type for a free-form task.
     *
     * @throws NoCandidateException if no agent is registered
     */
    public Agent assignTask(String task) {
        Agent agent = selector.selectBestAgent(task, registry.all());
        if (metrics != null) {
            metrics.recordTaskAssignment(String.valueOf(agent.type()));
        }
        log.info("Assigned task '{}' to agent {}", task, agent.id());
        return agent;
    }

    /**
     * Scores every registered agent for a task, in registration order.
     */
    public List<ScoredAgent> rankAgents(String task) {
        return selector.rank(task, registry.all());
    }

    /**
     * Compiles a definition without running it.
     *
     * @throws com.aigent.core.plan.WorkflowConfigurationException if the definition is invalid
     */
    public WorkflowPlan validateWorkflow(WorkflowDefinition definition) {
        return engine.compile(definition);
    }

    public WorkflowResult executeWorkflow(WorkflowDefinition definition) {
        return executeWorkflow(engine.generateWorkflowId(), definition);
    }

    public WorkflowResult executeWorkflow(String workflowId, WorkflowDefinition definition) {
        return engine.execute(workflowId, definition);
    }

    /**
     * Validates the definition on the calling thread, then runs it on the worker pool.
     */
    public WorkflowHandle submitWorkflow(WorkflowDefinition definition) {
        var plan = engine.compile(definition);
        String workflowId = engine.generateWorkflowId();
        WorkflowRun run = engine.prepare(workflowId, plan);
        CompletableFuture<WorkflowResult> future = CompletableFuture.supplyAsync(() -> engine.execute(run), executor);
        log.info("Submitted workflow '{}' as {}", plan.name(), workflowId);
        return new WorkflowHandle(workflowId, future, () -> engine.cancel(workflowId));
    }

    public boolean cancelWorkflow(String workflowId) {
        return engine.cancel(workflowId);
    }

    public Optional<WorkflowStatus> workflowStatus(String workflowId) {
        return engine.status(workflowId);
    }

    public List<WorkflowStatus> runningWorkflows() {
        return engine.running();
    }

    private void publish(String eventType, Map<String, Object> payload) {
        try {
            eventBus.publish(OrchestrationEvent.of(eventType, null, null, payload));
        } catch (Exception e) {
            log.warn("Failed to publish {}: {}", eventType, e.getMessage());
        }
    }
}
