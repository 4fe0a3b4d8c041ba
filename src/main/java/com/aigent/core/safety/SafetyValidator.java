package com.aigent.core.safety;

import com.aigent.core.agent.Agent;
import com.aigent.core.model.Action;

/**
 * Vets an action after the agent decided it and before it is executed.
 * A rejected action is never executed; the step fails with the validator's message.
 */
@FunctionalInterface
public interface SafetyValidator {

    ValidationResult validate(Agent agent, Action action);
}
