package com.aigent.core.agent;

import com.aigent.core.model.Action;
import com.aigent.core.model.ActionResult;
import com.aigent.core.model.AgentCapabilities;
import com.aigent.core.model.AgentType;
import com.aigent.core.model.EnvironmentState;

/**
 * An autonomous agent the orchestrator can select and drive.
 * <p>
 * Agents are created and initialised by the caller; the orchestrator only holds a reference
 * while they are registered. The orchestrator may call into the same agent instance from
 * several threads at once (concurrent steps of a PARALLEL workflow); implementations that
 * are not reentrant must serialise internally.
 */
public interface Agent {

    String id();

    String name();

    AgentType type();

    AgentCapabilities capabilities();

    /**
     * Decides the next action from the given environment snapshot.
     *
     * @throws DecisionException if no action can be decided
     */
    Action decideAction(EnvironmentState state) throws DecisionException;

    /**
     * Executes a previously decided action.
     *
     * @throws ActionExecutionException if the action could not be carried out
     */
    ActionResult execute(Action action) throws ActionExecutionException;
}
