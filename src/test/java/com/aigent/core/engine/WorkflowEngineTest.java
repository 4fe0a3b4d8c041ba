package com.aigent.core.engine;

import com.aigent.core.agent.FakeAgent;
import com.aigent.core.engine.strategy.SequentialStrategy;
import com.aigent.core.engine.strategy.WorkflowStrategy;
import com.aigent.core.events.OrchestrationEvent;
import com.aigent.core.model.ActionResult;
import com.aigent.core.model.AgentType;
import com.aigent.core.model.WorkflowDefinition;
import com.aigent.core.model.WorkflowState;
import com.aigent.core.model.WorkflowStep;
import com.aigent.core.model.WorkflowType;
import com.aigent.core.plan.WorkflowConfigurationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Year;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowEngineTest {

    private EngineFixture fixture;
    private WorkflowEngine engine;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        fixture.register(FakeAgent.succeeding("r", AgentType.REACTIVE));
        engine = fixture.engine();
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private static WorkflowDefinition twoSteps(WorkflowType type) {
        return WorkflowDefinition.of("two", type,
                WorkflowStep.of("a", AgentType.REACTIVE, Map.of()),
                WorkflowStep.of("b", AgentType.REACTIVE, Map.of()));
    }

    @Test
    @DisplayName("generates ids of the form WF-<year>-<seq>")
    void generatesIds() {
        String first = engine.generateWorkflowId();
        String second = engine.generateWorkflowId();

        assertTrue(first.matches("WF-" + Year.now().getValue() + "-\\d{4,}"), first);
        assertNotEquals(first, second);
    }

    @Nested
    @DisplayName("execute")
    class ExecuteTests {

        @Test
        @DisplayName("completed workflow reports state, events and metrics")
        void completed() {
            var result = engine.execute("WF-T-1", twoSteps(WorkflowType.SEQUENTIAL));

            assertTrue(result.success());
            assertEquals(WorkflowState.COMPLETED, result.state());
            assertEquals("WF-T-1", result.workflowId());
            assertEquals("two", result.workflowName());
            assertEquals(OrchestrationEvent.WORKFLOW_STARTED, fixture.eventTypes().get(0));
            assertEquals(OrchestrationEvent.WORKFLOW_COMPLETED,
                    fixture.eventTypes().get(fixture.eventTypes().size() - 1));
            var counter = fixture.meterRegistry.find("aigent.workflows.total")
                    .tag("type", "SEQUENTIAL").tag("status", "COMPLETED").counter();
            assertNotNull(counter);
            assertEquals(1.0, counter.count());
        }

        @Test
        @DisplayName("failed workflow ends in FAILED and publishes workflow.failed")
        void failed() {
            fixture.register(FakeAgent.failing("r", AgentType.REACTIVE, "nope"));

            var result = engine.execute("WF-T-2", twoSteps(WorkflowType.PARALLEL));

            assertFalse(result.success());
            assertEquals(WorkflowState.FAILED, result.state());
            assertTrue(fixture.eventTypes().contains(OrchestrationEvent.WORKFLOW_FAILED));
        }

        @Test
        @DisplayName("an agent throwing an Error fails its step and the run still finishes")
        void agentError() {
            fixture.register(FakeAgent.succeeding("r", AgentType.REACTIVE)
                    .onDecide(state -> { throw new AssertionError("agent blew up"); }));

            var result = engine.execute("WF-T-E1", twoSteps(WorkflowType.SEQUENTIAL));

            assertEquals(WorkflowState.FAILED, result.state());
            assertEquals(List.of("Error in step a: agent blew up"), result.errors());
            assertTrue(engine.running().isEmpty());
            assertEquals(WorkflowState.FAILED, engine.status("WF-T-E1").orElseThrow().state());
            assertEquals(OrchestrationEvent.WORKFLOW_FAILED,
                    fixture.eventTypes().get(fixture.eventTypes().size() - 1));
        }

        @Test
        @DisplayName("an Error in a parallel step is recorded against that step only")
        void parallelAgentError() {
            fixture.register(FakeAgent.succeeding("r", AgentType.REACTIVE),
                    FakeAgent.succeeding("d", AgentType.DELIBERATIVE)
                            .onExecute(action -> { throw new StackOverflowError(); }));
            var definition = WorkflowDefinition.of("par", WorkflowType.PARALLEL,
                    WorkflowStep.of("a", AgentType.REACTIVE, Map.of()),
                    WorkflowStep.of("b", AgentType.DELIBERATIVE, Map.of()));

            var result = engine.execute("WF-T-E2", definition);

            assertEquals(WorkflowState.FAILED, result.state());
            assertEquals(List.of("Error in step b: StackOverflowError"), result.errors());
            assertTrue(result.actionResult("a").success());
            assertTrue(engine.running().isEmpty());
        }

        @Test
        @DisplayName("a strategy throwing an Error still releases the run and clears the MDC")
        void strategyError() {
            var broken = new WorkflowStrategy() {
                @Override
                public WorkflowType type() {
                    return WorkflowType.SEQUENTIAL;
                }

                @Override
                public void execute(WorkflowRun run) {
                    throw new NoClassDefFoundError("com/example/Missing");
                }
            };
            var brokenEngine = new WorkflowEngine(fixture.compiler, List.of(broken), fixture.eventBus,
                    fixture.properties, fixture.metrics);
            var definition = twoSteps(WorkflowType.SEQUENTIAL);

            var result = brokenEngine.execute("WF-T-E3", definition);

            assertEquals(WorkflowState.FAILED, result.state());
            assertEquals(List.of("Workflow failed: com/example/Missing"), result.errors());
            assertTrue(brokenEngine.running().isEmpty());
            assertNull(MDC.get("workflowId"));
            assertTrue(fixture.eventTypes().contains(OrchestrationEvent.WORKFLOW_FAILED));
            assertDoesNotThrow(() -> brokenEngine.execute("WF-T-E3", definition));
        }

        @Test
        @DisplayName("invalid definitions throw before anything runs")
        void invalid() {
            var definition = WorkflowDefinition.of("bad", WorkflowType.SEQUENTIAL,
                    WorkflowStep.of("a", AgentType.REACTIVE, Map.of()).withDependencies("ghost"));

            assertThrows(WorkflowConfigurationException.class, () -> engine.execute("WF-T-3", definition));
            assertTrue(fixture.events.isEmpty());
            assertTrue(engine.status("WF-T-3").isEmpty());
        }

        @Test
        @DisplayName("workflow type without a strategy is a configuration error")
        void missingStrategy() {
            var sequentialOnly = new WorkflowEngine(fixture.compiler,
                    List.of(new SequentialStrategy(fixture.stepRunner())), fixture.eventBus, fixture.properties, null);

            assertThrows(WorkflowConfigurationException.class,
                    () -> sequentialOnly.compile(twoSteps(WorkflowType.HIERARCHICAL)));
        }

        @Test
        @DisplayName("an id that is still running cannot be reused")
        void duplicateId() {
            var plan = engine.compile(twoSteps(WorkflowType.SEQUENTIAL));
            engine.prepare("WF-DUP", plan);

            assertThrows(WorkflowConfigurationException.class, () -> engine.prepare("WF-DUP", plan));
        }

        @Test
        @DisplayName("a workflow deadline ends the run as TIMED_OUT, keeping finished steps")
        void timesOut() {
            fixture.register(FakeAgent.succeeding("r", AgentType.REACTIVE).onExecute(action -> {
                try {
                    Thread.sleep(3_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return ActionResult.succeeded("late");
            }));
            var definition = WorkflowDefinition.of("slow", WorkflowType.SEQUENTIAL,
                    WorkflowStep.of("a", AgentType.REACTIVE, Map.of()),
                    WorkflowStep.of("b", AgentType.REACTIVE, Map.of())).withTimeoutSeconds(1);

            var result = engine.execute("WF-T-4", definition);

            assertEquals(WorkflowState.TIMED_OUT, result.state());
            assertFalse(result.success());
            assertEquals(List.of("Workflow timed out after 1 seconds"), result.errors());
            assertTrue(result.results().isEmpty());
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("cancelling a running workflow stops it before the next step")
        void cancel() throws Exception {
            var entered = new CountDownLatch(1);
            var release = new CountDownLatch(1);
            var calls = new AtomicInteger();
            fixture.register(FakeAgent.succeeding("r", AgentType.REACTIVE).onExecute(action -> {
                if (calls.incrementAndGet() == 2) {
                    entered.countDown();
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return ActionResult.succeeded("done");
            }));
            var definition = WorkflowDefinition.of("three", WorkflowType.SEQUENTIAL,
                    WorkflowStep.of("a", AgentType.REACTIVE, Map.of()),
                    WorkflowStep.of("b", AgentType.REACTIVE, Map.of()),
                    WorkflowStep.of("c", AgentType.REACTIVE, Map.of()));
            var run = engine.prepare("WF-C-1", engine.compile(definition));
            var future = CompletableFuture.supplyAsync(() -> engine.execute(run), fixture.executor);

            assertTrue(entered.await(5, TimeUnit.SECONDS));
            assertEquals(WorkflowState.RUNNING, engine.status("WF-C-1").orElseThrow().state());
            assertEquals(1, engine.running().size());

            assertTrue(engine.cancel("WF-C-1"));
            assertFalse(engine.cancel("WF-C-1"));
            release.countDown();
            var result = future.get(5, TimeUnit.SECONDS);

            assertEquals(WorkflowState.CANCELLED, result.state());
            assertEquals(List.of("a", "b"), List.copyOf(result.results().keySet()));
            assertEquals(List.of("Workflow cancelled"), result.errors());
            assertEquals(2, calls.get());
            assertTrue(engine.running().isEmpty());
            var status = engine.status("WF-C-1").orElseThrow();
            assertEquals(WorkflowState.CANCELLED, status.state());
            assertEquals(2, status.completedSteps());
            assertEquals(3, status.totalSteps());
            assertNotNull(status.finishedAt());
        }

        @Test
        @DisplayName("cancelling before start yields CANCELLED without running any step")
        void cancelPending() {
            var agent = FakeAgent.succeeding("r", AgentType.REACTIVE);
            fixture.register(agent);
            var run = engine.prepare("WF-C-2", engine.compile(twoSteps(WorkflowType.HIERARCHICAL)));

            assertEquals(WorkflowState.PENDING, engine.status("WF-C-2").orElseThrow().state());
            assertTrue(engine.cancel("WF-C-2"));
            var result = engine.execute(run);

            assertEquals(WorkflowState.CANCELLED, result.state());
            assertTrue(agent.observed().isEmpty());
        }

        @Test
        @DisplayName("unknown ids cannot be cancelled or queried")
        void unknownIds() {
            assertFalse(engine.cancel("WF-NOPE"));
            assertFalse(engine.cancel(null));
            assertTrue(engine.status("WF-NOPE").isEmpty());
        }

        @Test
        @DisplayName("finished history is bounded")
        void boundedHistory() {
            fixture.properties.getWorkflow().setHistorySize(2);
            engine.execute("WF-H-1", twoSteps(WorkflowType.SEQUENTIAL));
            engine.execute("WF-H-2", twoSteps(WorkflowType.SEQUENTIAL));
            engine.execute("WF-H-3", twoSteps(WorkflowType.SEQUENTIAL));

            assertTrue(engine.status("WF-H-1").isEmpty());
            assertEquals(WorkflowState.COMPLETED, engine.status("WF-H-3").orElseThrow().state());
            assertEquals(2, engine.status("WF-H-3").orElseThrow().completedSteps());
        }
    }
}
