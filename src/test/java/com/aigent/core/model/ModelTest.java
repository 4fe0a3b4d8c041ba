package com.aigent.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Nested
    @DisplayName("AgentCapabilities")
    class AgentCapabilitiesTests {

        @Test
        @DisplayName("rejects load factor above 1.0")
        void rejectsLoadAboveOne() {
            assertThrows(IllegalArgumentException.class,
                    () -> new AgentCapabilities(Set.of(), Map.of(), 1.5, 0.5));
        }

        @Test
        @DisplayName("rejects negative historical performance")
        void rejectsNegativePerformance() {
            assertThrows(IllegalArgumentException.class,
                    () -> new AgentCapabilities(Set.of(), Map.of(), 0.5, -0.1));
        }

        @Test
        @DisplayName("rejects skill levels out of range")
        void rejectsSkillOutOfRange() {
            var ex = assertThrows(IllegalArgumentException.class,
                    () -> new AgentCapabilities(Set.of(), Map.of("planning", 2.0), 0.0, 0.0));
            assertTrue(ex.getMessage().contains("planning"));
        }

        @Test
        @DisplayName("skillLevel returns 0.0 for undeclared skills")
        void undeclaredSkillIsZero() {
            var caps = new AgentCapabilities(Set.of("Planning"), Map.of("planning", 0.7), 0.2, 0.9);
            assertEquals(0.7, caps.skillLevel("planning"));
            assertEquals(0.0, caps.skillLevel("weather_analysis"));
            assertEquals(0.0, caps.skillLevel(null));
        }
    }

    @Nested
    @DisplayName("WorkflowStep")
    class WorkflowStepTests {

        @Test
        @DisplayName("de-duplicates dependencies keeping first occurrence order")
        void deduplicatesDependencies() {
            var step = WorkflowStep.of("c", AgentType.REACTIVE, Map.of()).withDependencies("b", "a", "b");
            assertEquals(List.of("b", "a"), step.dependencies());
        }

        @Test
        @DisplayName("parameters are an immutable copy")
        void parametersAreCopied() {
            var params = new LinkedHashMap<String, Object>();
            params.put("input", "x");
            var step = WorkflowStep.of("a", AgentType.REACTIVE, params);
            params.put("input", "changed");

            assertEquals("x", step.parameters().get("input"));
            assertThrows(UnsupportedOperationException.class, () -> step.parameters().put("k", "v"));
        }
    }

    @Nested
    @DisplayName("StepResult")
    class StepResultTests {

        @Test
        @DisplayName("succeeded is false when any descendant failed")
        void failedDescendant() {
            var grandChild = StepResult.of(ActionResult.failed("boom"));
            var child = new StepResult(ActionResult.succeeded("ok"), Map.of("d", grandChild));
            var root = new StepResult(ActionResult.succeeded("ok"), Map.of("b", child));

            assertFalse(root.succeeded());
            assertTrue(root.result().success());
            assertSame(grandChild, root.find("d"));
            assertNull(root.find("missing"));
        }
    }

    @Nested
    @DisplayName("WorkflowState")
    class WorkflowStateTests {

        @Test
        @DisplayName("only running and pending are non-terminal")
        void terminalStates() {
            assertFalse(WorkflowState.PENDING.isTerminal());
            assertFalse(WorkflowState.RUNNING.isTerminal());
            assertTrue(WorkflowState.COMPLETED.isTerminal());
            assertTrue(WorkflowState.FAILED.isTerminal());
            assertTrue(WorkflowState.CANCELLED.isTerminal());
            assertTrue(WorkflowState.TIMED_OUT.isTerminal());
        }
    }

    @Test
    @DisplayName("EnvironmentState exposes injected dependency outputs")
    void environmentDependency() {
        var output = ActionResult.succeeded("sunny");
        var state = EnvironmentState.of(Map.of("input", "plan", EnvironmentState.DEPENDENCY_PREFIX + "forecast", output));

        assertEquals(output, state.dependency("forecast").orElseThrow());
        assertTrue(state.dependency("other").isEmpty());
        assertEquals("plan", state.getString("input").orElseThrow());
    }
}
