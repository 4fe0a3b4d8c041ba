package com.aigent.core.engine.strategy;

import com.aigent.core.agent.FakeAgent;
import com.aigent.core.engine.EngineFixture;
import com.aigent.core.events.OrchestrationEvent;
import com.aigent.core.model.Action;
import com.aigent.core.model.ActionResult;
import com.aigent.core.model.AgentType;
import com.aigent.core.model.WorkflowDefinition;
import com.aigent.core.model.WorkflowStep;
import com.aigent.core.model.WorkflowType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConditionalStrategyTest {

    private EngineFixture fixture;
    private ConditionalStrategy strategy;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        strategy = new ConditionalStrategy(fixture.stepRunner());
        fixture.register(FakeAgent.succeeding("r", AgentType.REACTIVE)
                .onDecide(state -> new Action("Act", state.getString("outcome").orElse("ok"), Map.of()))
                .onExecute(action -> "fail".equals(action.description())
                        ? ActionResult.failed("refused")
                        : ActionResult.succeeded("done")));
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private static WorkflowStep step(String name, String outcome) {
        return WorkflowStep.of(name, AgentType.REACTIVE, Map.of("outcome", outcome));
    }

    @Test
    @DisplayName("a step whose condition step has not run is skipped without affecting success")
    void skipsUnmetReference() {
        var run = fixture.run(WorkflowDefinition.of("cond", WorkflowType.CONDITIONAL,
                step("A", "ok"),
                step("B", "ok").withCondition("C.Success == true"),
                step("C", "ok")));

        strategy.execute(run);
        var result = run.toResult();

        assertEquals(List.of("A", "C"), List.copyOf(result.results().keySet()));
        assertTrue(result.errors().isEmpty());
        assertTrue(result.success());
        assertTrue(fixture.eventTypes().contains(OrchestrationEvent.STEP_SKIPPED));
        assertEquals(1.0, fixture.meterRegistry.find("aigent.steps.skipped").counter().count());
    }

    @Test
    @DisplayName("runs the success branch or the failure branch")
    void branches() {
        var run = fixture.run(WorkflowDefinition.of("cond", WorkflowType.CONDITIONAL,
                step("check", "fail"),
                step("onSuccess", "ok").withCondition("check.Success == true"),
                step("onFailure", "ok").withCondition("check.Success == false")));

        strategy.execute(run);
        var result = run.toResult();

        assertEquals(List.of("check", "onFailure"), List.copyOf(result.results().keySet()));
        assertEquals(List.of("Error in step check: refused"), result.errors());
        assertFalse(result.success());
    }

    @Test
    @DisplayName("a failed step does not stop later steps")
    void continuesAfterFailure() {
        var run = fixture.run(WorkflowDefinition.of("cond", WorkflowType.CONDITIONAL,
                step("A", "fail"), step("B", "ok")));

        strategy.execute(run);

        assertEquals(List.of("A", "B"), List.copyOf(run.toResult().results().keySet()));
    }

    @Test
    @DisplayName("a step runs when its dependency is present even if it failed")
    void dependencyPresence() {
        var run = fixture.run(WorkflowDefinition.of("cond", WorkflowType.CONDITIONAL,
                step("A", "fail"),
                step("B", "ok").withDependencies("A"),
                WorkflowStep.of("X", AgentType.BDI, Map.of()),
                step("Y", "ok").withDependencies("X")));

        strategy.execute(run);
        var result = run.toResult();

        assertTrue(result.results().containsKey("B"));
        assertFalse(result.results().containsKey("Y"));
        assertEquals(List.of("Error in step A: refused", "No agent of type BDI available for step X"),
                result.errors());
    }
}
