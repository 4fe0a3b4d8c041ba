package com.aigent.core.agent;

import com.aigent.core.model.Action;
import com.aigent.core.model.ActionResult;
import com.aigent.core.model.AgentCapabilities;
import com.aigent.core.model.AgentType;
import com.aigent.core.model.EnvironmentState;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reactive agent driven by a keyword rule table.
 * <p>
 * {@link #decideAction} scans the string-valued properties of the environment (dependency
 * outputs excluded) for the first rule whose keyword occurs, case-insensitively. When nothing
 * matches, the fallback rule applies; without one, the decision fails.
 * Stateless and therefore safe to call concurrently.
 */
public class RuleBasedAgent implements Agent {

    /**
     * One entry of the rule table.
     *
     * @param keyword    text that triggers the rule (ignored on the fallback rule)
     * @param actionType action type produced
     * @param message    outcome message reported when the action executes
     * @param fails      when true the action executes but reports failure
     */
    public record Rule(String keyword, String actionType, String message, boolean fails) {}

    private final String id;
    private final String name;
    private final AgentType type;
    private final AgentCapabilities capabilities;
    private final List<Rule> rules;
    private final Rule fallback;

    public RuleBasedAgent(String id, String name, AgentType type, AgentCapabilities capabilities,
                          List<Rule> rules, Rule fallback) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name != null ? name : id;
        this.type = Objects.requireNonNull(type, "type");
        this.capabilities = capabilities != null ? capabilities : AgentCapabilities.none();
        this.rules = rules != null ? List.copyOf(rules) : List.of();
        this.fallback = fallback;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public AgentType type() {
        return type;
    }

    @Override
    public AgentCapabilities capabilities() {
        return capabilities;
    }

    @Override
    public Action decideAction(EnvironmentState state) throws DecisionException {
        String text = searchableText(state);
        for (var rule : rules) {
            if (rule.keyword() != null && text.contains(rule.keyword().toLowerCase())) {
                return toAction(rule, rule.keyword());
            }
        }
        if (fallback != null) {
            return toAction(fallback, null);
        }
        throw new DecisionException("Agent " + id + " has no rule matching the environment");
    }

    @Override
    public ActionResult execute(Action action) throws ActionExecutionException {
        if (action == null) {
            throw new ActionExecutionException("Agent " + id + " received no action");
        }
        var data = new LinkedHashMap<String, Object>(action.parameters());
        data.put("agentId", id);
        data.put("actionType", action.type());
        boolean fails = Boolean.TRUE.equals(action.parameters().get("fails"));
        return fails
                ? new ActionResult(false, action.description(), data, null)
                : ActionResult.succeeded(action.description(), data);
    }

    private Action toAction(Rule rule, String matchedKeyword) {
        var params = new LinkedHashMap<String, Object>();
        if (matchedKeyword != null) {
            params.put("matchedKeyword", matchedKeyword);
        }
        params.put("fails", rule.fails());
        return new Action(rule.actionType(), rule.message(), params);
    }

    private static String searchableText(EnvironmentState state) {
        var sb = new StringBuilder();
        for (Map.Entry<String, Object> entry : state.properties().entrySet()) {
            if (entry.getKey().startsWith(EnvironmentState.DEPENDENCY_PREFIX)) {
                continue;
            }
            if (entry.getValue() instanceof String s) {
                sb.append(s.toLowerCase()).append('\n');
            }
        }
        return sb.toString();
    }
}
