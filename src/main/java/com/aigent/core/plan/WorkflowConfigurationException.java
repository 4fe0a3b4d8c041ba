package com.aigent.core.plan;

/**
 * Thrown when a workflow definition is structurally invalid. The workflow is never started.
 */
public class WorkflowConfigurationException extends RuntimeException {
    public WorkflowConfigurationException(String message) {
        super(message);
    }
}
