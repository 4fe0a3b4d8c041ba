package com.aigent.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing orchestrator MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String WORKFLOW_ID = "workflowId";
    public static final String STEP_NAME = "stepName";
    public static final String AGENT_ID = "agentId";

    private MdcContext() {}

    public static void setWorkflow(String workflowId) {
        MDC.put(WORKFLOW_ID, workflowId);
    }

    public static void setStep(String workflowId, String stepName, String agentId) {
        MDC.put(WORKFLOW_ID, workflowId);
        MDC.put(STEP_NAME, stepName);
        if (agentId != null) {
            MDC.put(AGENT_ID, agentId);
        } else {
            MDC.remove(AGENT_ID);
        }
    }

    /** Drops step-level keys, keeping the workflow id. */
    public static void clearStep() {
        MDC.remove(STEP_NAME);
        MDC.remove(AGENT_ID);
    }

    public static void clear() {
        MDC.remove(WORKFLOW_ID);
        MDC.remove(STEP_NAME);
        MDC.remove(AGENT_ID);
    }
}
