package com.aigent.core.plan;

import com.aigent.core.model.WorkflowDefinition;
import com.aigent.core.model.WorkflowStep;
import com.aigent.core.model.WorkflowType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates a {@link WorkflowDefinition} and compiles it into a {@link WorkflowPlan}.
 * <p>
 * Rejected before execution: a missing type, blank or duplicate step names, a step without
 * an agent type, dependencies on unknown steps or on the step itself, dependency cycles
 * (for every workflow type), malformed conditions and negative timeouts.
 */
@Component
public class WorkflowPlanCompiler {

    private static final Logger log = LoggerFactory.getLogger(WorkflowPlanCompiler.class);

    /** Step parameters whose string values describe the task to the agent selector. */
    static final List<String> TASK_PARAMETERS = List.of("input", "task", "description");

    public WorkflowPlan compile(WorkflowDefinition definition) {
        if (definition == null) {
            throw new WorkflowConfigurationException("Workflow definition must not be null");
        }
        if (definition.type() == null) {
            throw new WorkflowConfigurationException(
                    "Unknown workflow type for workflow '" + definition.name() + "'");
        }
        requireNonNegative(definition.timeoutSeconds(), "Workflow '" + definition.name() + "' timeout");

        List<WorkflowStep> steps = definition.steps();
        var indexByName = new HashMap<String, Integer>();
        for (int i = 0; i < steps.size(); i++) {
            var step = steps.get(i);
            if (step == null || step.name() == null || step.name().isBlank()) {
                throw new WorkflowConfigurationException(
                        "Step #" + (i + 1) + " of workflow '" + definition.name() + "' has no name");
            }
            if (indexByName.putIfAbsent(step.name(), i) != null) {
                throw new WorkflowConfigurationException("Duplicate step name: " + step.name());
            }
            if (step.requiredAgentType() == null) {
                throw new WorkflowConfigurationException("Step " + step.name() + " has no required agent type");
            }
            requireNonNegative(step.timeoutSeconds(), "Step " + step.name() + " timeout");
        }

        var dependencyIndices = new ArrayList<List<Integer>>();
        var childIndices = new ArrayList<List<Integer>>();
        for (int i = 0; i < steps.size(); i++) {
            childIndices.add(new ArrayList<>());
        }
        for (int i = 0; i < steps.size(); i++) {
            var step = steps.get(i);
            var deps = new ArrayList<Integer>();
            for (String dep : step.dependencies()) {
                Integer target = indexByName.get(dep);
                if (target == null) {
                    throw new WorkflowConfigurationException(
                            "Step " + step.name() + " depends on unknown step: " + dep);
                }
                if (target == i) {
                    throw new WorkflowConfigurationException("Step " + step.name() + " depends on itself");
                }
                deps.add(target);
                childIndices.get(target).add(i);
            }
            dependencyIndices.add(deps);
        }

        var order = topologicalOrder(steps, dependencyIndices, childIndices);

        var nodes = new ArrayList<PlanNode>();
        var roots = new ArrayList<Integer>();
        for (int i = 0; i < steps.size(); i++) {
            var step = steps.get(i);
            StepCondition condition = compileCondition(definition.type(), step, indexByName);
            nodes.add(new PlanNode(i, step, List.copyOf(dependencyIndices.get(i)),
                    List.copyOf(childIndices.get(i)), condition, taskDescriptor(step)));
            if (dependencyIndices.get(i).isEmpty()) {
                roots.add(i);
            }
        }

        log.debug("Compiled workflow '{}' ({}): {} steps, {} roots",
                definition.name(), definition.type(), nodes.size(), roots.size());
        return new WorkflowPlan(definition.name(), definition.type(), definition.timeoutSeconds(),
                List.copyOf(nodes), List.copyOf(roots), List.copyOf(order));
    }

    /**
     * Kahn's algorithm; any step left over sits on a cycle.
     */
    private List<Integer> topologicalOrder(List<WorkflowStep> steps, List<List<Integer>> dependencies,
                                           List<List<Integer>> children) {
        int[] pending = new int[steps.size()];
        var ready = new ArrayDeque<Integer>();
        for (int i = 0; i < steps.size(); i++) {
            pending[i] = dependencies.get(i).size();
            if (pending[i] == 0) {
                ready.add(i);
            }
        }
        var order = new ArrayList<Integer>();
        while (!ready.isEmpty()) {
            int current = ready.poll();
            order.add(current);
            for (int child : children.get(current)) {
                if (--pending[child] == 0) {
                    ready.add(child);
                }
            }
        }
        if (order.size() < steps.size()) {
            var cyclic = new ArrayList<String>();
            for (int i = 0; i < steps.size(); i++) {
                if (pending[i] > 0) {
                    cyclic.add(steps.get(i).name());
                }
            }
            throw new WorkflowConfigurationException("Dependency cycle detected among steps: " + cyclic);
        }
        return order;
    }

    private StepCondition compileCondition(WorkflowType type, WorkflowStep step, Map<String, Integer> indexByName) {
        if (step.condition() == null || step.condition().isBlank()) {
            return null;
        }
        if (type != WorkflowType.CONDITIONAL) {
            log.warn("Ignoring condition on step {}: only CONDITIONAL workflows evaluate conditions", step.name());
            return null;
        }
        var condition = StepCondition.parse(step.condition());
        if (!indexByName.containsKey(condition.stepName())) {
            throw new WorkflowConfigurationException(
                    "Condition of step " + step.name() + " references unknown step: " + condition.stepName());
        }
        if (condition.stepName().equals(step.name())) {
            throw new WorkflowConfigurationException("Condition of step " + step.name() + " references itself");
        }
        return condition;
    }

    /**
     * The step name followed by any textual task parameters.
     */
    static String taskDescriptor(WorkflowStep step) {
        var sb = new StringBuilder(step.name());
        for (String key : TASK_PARAMETERS) {
            if (step.parameters().get(key) instanceof String text && !text.isBlank()) {
                sb.append(' ').append(text);
            }
        }
        return sb.toString();
    }

    private static void requireNonNegative(Integer seconds, String what) {
        if (seconds != null && seconds < 0) {
            throw new WorkflowConfigurationException(what + " must not be negative: " + seconds);
        }
    }
}
