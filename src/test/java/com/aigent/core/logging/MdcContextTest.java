package com.aigent.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setWorkflow puts workflowId in MDC")
    void setWorkflow() {
        MdcContext.setWorkflow("WF-2026-0001");
        assertEquals("WF-2026-0001", MDC.get("workflowId"));
    }

    @Test
    @DisplayName("setStep puts workflowId, stepName and agentId in MDC")
    void setStep() {
        MdcContext.setStep("WF-2026-0001", "step1", "weather");
        assertEquals("WF-2026-0001", MDC.get("workflowId"));
        assertEquals("step1", MDC.get("stepName"));
        assertEquals("weather", MDC.get("agentId"));
    }

    @Test
    @DisplayName("setStep without an agent drops a stale agentId")
    void setStepWithoutAgent() {
        MdcContext.setStep("WF-2026-0001", "step1", "weather");
        MdcContext.setStep("WF-2026-0001", "step2", null);
        assertEquals("step2", MDC.get("stepName"));
        assertNull(MDC.get("agentId"));
    }

    @Test
    @DisplayName("clearStep keeps the workflow id")
    void clearStep() {
        MdcContext.setStep("WF-2026-0001", "step1", "weather");
        MdcContext.clearStep();
        assertEquals("WF-2026-0001", MDC.get("workflowId"));
        assertNull(MDC.get("stepName"));
        assertNull(MDC.get("agentId"));
    }

    @Test
    @DisplayName("clear removes all orchestrator MDC keys")
    void clear() {
        MdcContext.setStep("WF-2026-0001", "step1", "weather");
        MdcContext.clear();
        assertNull(MDC.get("workflowId"));
        assertNull(MDC.get("stepName"));
        assertNull(MDC.get("agentId"));
    }
}
