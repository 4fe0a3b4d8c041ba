package com.aigent.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * A single unit of work within a workflow.
 *
 * @param name              identifier, unique within the workflow
 * @param requiredAgentType type of agent that must execute the step
 * @param parameters        environment properties handed to the agent
 * @param dependencies      names of steps that must complete first (duplicates removed, order kept)
 * @param condition         Conditional workflows only, e.g. {@code "step1.Success == true"}; nullable
 * @param timeoutSeconds    per-step deadline overriding the configured default; nullable, 0 = none
 */
public record WorkflowStep(
    String name,
    AgentType requiredAgentType,
    Map<String, Object> parameters,
    List<String> dependencies,
    String condition,
    Integer timeoutSeconds
) {

    public WorkflowStep {
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        dependencies = dependencies == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(dependencies)));
    }

    public static WorkflowStep of(String name, AgentType requiredAgentType, Map<String, Object> parameters) {
        return new WorkflowStep(name, requiredAgentType, parameters, List.of(), null, null);
    }

    public WorkflowStep withDependencies(String... names) {
        return new WorkflowStep(name, requiredAgentType, parameters, Arrays.asList(names), condition,
                timeoutSeconds);
    }

    public WorkflowStep withCondition(String expression) {
        return new WorkflowStep(name, requiredAgentType, parameters, dependencies, expression, timeoutSeconds);
    }

    public WorkflowStep withTimeoutSeconds(Integer seconds) {
        return new WorkflowStep(name, requiredAgentType, parameters, dependencies, condition, seconds);
    }
}
