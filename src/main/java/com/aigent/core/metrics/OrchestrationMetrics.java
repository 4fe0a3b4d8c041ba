package com.aigent.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralised Micrometer metrics for agent selection and workflow execution.
 */
@Service
public class OrchestrationMetrics {

    private final MeterRegistry registry;

    public OrchestrationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordWorkflowResult(String type, String status) {
        Counter.builder("aigent.workflows.total")
                .tag("type", type)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordWorkflowDuration(String workflowName, long ms) {
        Timer.builder("aigent.workflow.duration")
                .tag("workflow", workflowName)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param outcome "success" or "failure"
     */
    public void recordStepDuration(String workflowName, String stepName, String outcome, long ms) {
        Timer.builder("aigent.step.duration")
                .tag("workflow", workflowName)
                .tag("step", stepName)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordStepSkipped(String workflowName) {
        Counter.builder("aigent.steps.skipped")
                .description("Conditional steps skipped because their condition was not met")
                .tag("workflow", workflowName)
                .register(registry)
                .increment();
    }

    public void recordTaskAssignment(String agentType) {
        Counter.builder("aigent.task.assignments")
                .tag("agentType", agentType)
                .register(registry)
                .increment();
    }

    /**
     * Exposes the number of registered agents as a gauge.
     */
    public void bindRegisteredAgents(Supplier<Number> count) {
        Gauge.builder("aigent.agents.registered", count)
                .description("Agents currently registered with the orchestrator")
                .register(registry);
    }
}
