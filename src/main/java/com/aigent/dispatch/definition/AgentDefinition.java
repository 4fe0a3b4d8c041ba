package com.aigent.dispatch.definition;

import com.aigent.core.agent.RuleBasedAgent;
import com.aigent.core.model.AgentCapabilities;
import com.aigent.core.model.AgentType;

import java.util.List;

/**
 * Declarative description of a {@link RuleBasedAgent} in an agents file.
 */
public record AgentDefinition(
    String id,
    String name,
    AgentType type,
    AgentCapabilities capabilities,
    List<RuleBasedAgent.Rule> rules,
    RuleBasedAgent.Rule fallback
) {

    public RuleBasedAgent toAgent() {
        return new RuleBasedAgent(id, name, type, capabilities, rules, fallback);
    }
}
