package com.aigent.core.engine;

import com.aigent.core.agent.Agent;
import com.aigent.core.config.OrchestratorProperties;
import com.aigent.core.engine.strategy.ConditionalStrategy;
import com.aigent.core.engine.strategy.HierarchicalStrategy;
import com.aigent.core.engine.strategy.ParallelStrategy;
import com.aigent.core.engine.strategy.SequentialStrategy;
import com.aigent.core.engine.strategy.WorkflowStrategy;
import com.aigent.core.events.EventBus;
import com.aigent.core.events.OrchestrationEvent;
import com.aigent.core.metrics.OrchestrationMetrics;
import com.aigent.core.model.WorkflowDefinition;
import com.aigent.core.orchestrator.Orchestrator;
import com.aigent.core.plan.WorkflowPlanCompiler;
import com.aigent.core.registry.AgentRegistry;
import com.aigent.core.safety.SafetyValidator;
import com.aigent.core.selection.AgentSelector;
import com.aigent.core.selection.KeywordTaskClassifier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the engine's collaborators by hand for tests, without a Spring context.
 * Every published event is captured in {@link #events}.
 */
public final class EngineFixture implements AutoCloseable {

    private static final AtomicInteger RUN_COUNTER = new AtomicInteger();

    public final AgentRegistry registry = new AgentRegistry();
    public final EventBus eventBus = new EventBus();
    public final OrchestratorProperties properties = new OrchestratorProperties();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final OrchestrationMetrics metrics = new OrchestrationMetrics(meterRegistry);
    public final ExecutorService executor = Executors.newCachedThreadPool();
    public final WorkflowPlanCompiler compiler = new WorkflowPlanCompiler();
    public final AgentSelector selector = new AgentSelector(new KeywordTaskClassifier());
    public final List<OrchestrationEvent> events = new CopyOnWriteArrayList<>();

    private SafetyValidator safetyValidator;

    public EngineFixture() {
        eventBus.subscribeAll(events::add);
    }

    public EngineFixture withSafetyValidator(SafetyValidator validator) {
        this.safetyValidator = validator;
        return this;
    }

    public EngineFixture register(Agent... agents) {
        for (Agent agent : agents) {
            registry.register(agent);
        }
        return this;
    }

    public StepExecutor stepExecutor() {
        return new StepExecutor(executor, eventBus, properties, safetyValidator);
    }

    public StepRunner stepRunner() {
        return new StepRunner(registry, selector, stepExecutor(), eventBus, metrics);
    }

    public List<WorkflowStrategy> strategies() {
        StepRunner runner = stepRunner();
        return List.of(
                new SequentialStrategy(runner),
                new ParallelStrategy(runner, executor, properties),
                new ConditionalStrategy(runner),
                new HierarchicalStrategy(runner));
    }

    public WorkflowEngine engine() {
        return new WorkflowEngine(compiler, strategies(), eventBus, properties, metrics);
    }

    public Orchestrator orchestrator() {
        return new Orchestrator(registry, selector, engine(), eventBus, executor, metrics);
    }

    /**
     * Compiles the definition into a started run with no deadline, ready for a strategy.
     */
    public WorkflowRun run(WorkflowDefinition definition) {
        return run(definition, ExecutionControl.unbounded());
    }

    public WorkflowRun run(WorkflowDefinition definition, ExecutionControl control) {
        control.start();
        return new WorkflowRun("WF-TEST-" + RUN_COUNTER.incrementAndGet(), compiler.compile(definition), control);
    }

    public List<String> eventTypes() {
        return events.stream().map(OrchestrationEvent::eventType).toList();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
