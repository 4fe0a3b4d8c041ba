package com.aigent.core.model;

/**
 * Agent family tag used to match agents against workflow steps.
 */
public enum AgentType {
    REACTIVE,
    DELIBERATIVE,
    HYBRID,
    BDI,
    UTILITY_BASED,
    LEARNING,
    ADAPTIVE,
    ORCHESTRATOR
}
