package com.aigent.core.agent;

import com.aigent.core.model.Action;
import com.aigent.core.model.ActionResult;
import com.aigent.core.model.AgentCapabilities;
import com.aigent.core.model.AgentType;
import com.aigent.core.model.EnvironmentState;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Scriptable agent for tests. Records every snapshot it was asked to decide on and every
 * action it executed.
 */
public class FakeAgent implements Agent {

    @FunctionalInterface
    public interface Decider {
        Action decide(EnvironmentState state) throws DecisionException;
    }

    @FunctionalInterface
    public interface Executor {
        ActionResult execute(Action action) throws ActionExecutionException;
    }

    private final String id;
    private final AgentType type;
    private final AgentCapabilities capabilities;
    private final Decider decider;
    private final Executor executor;

    private final List<EnvironmentState> observed = new CopyOnWriteArrayList<>();
    private final List<Action> executed = new CopyOnWriteArrayList<>();

    public FakeAgent(String id, AgentType type, AgentCapabilities capabilities, Decider decider, Executor executor) {
        this.id = id;
        this.type = type;
        this.capabilities = capabilities;
        this.decider = decider;
        this.executor = executor;
    }

    public static FakeAgent succeeding(String id, AgentType type) {
        return new FakeAgent(id, type, AgentCapabilities.none(),
                state -> Action.of("Act", "act for " + id),
                action -> ActionResult.succeeded(id + " done"));
    }

    public static FakeAgent failing(String id, AgentType type, String message) {
        return succeeding(id, type).onExecute(action -> ActionResult.failed(message));
    }

    public FakeAgent withCapabilities(AgentCapabilities capabilities) {
        return new FakeAgent(id, type, capabilities, decider, executor);
    }

    public FakeAgent onDecide(Decider decider) {
        return new FakeAgent(id, type, capabilities, decider, executor);
    }

    public FakeAgent onExecute(Executor executor) {
        return new FakeAgent(id, type, capabilities, decider, executor);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String name() {
        return "fake-" + id;
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
        observed.add(state);
        return decider.decide(state);
    }

    @Override
    public ActionResult execute(Action action) throws ActionExecutionException {
        executed.add(action);
        return executor.execute(action);
    }

    public List<EnvironmentState> observed() {
        return observed;
    }

    public List<Action> executed() {
        return executed;
    }

    public EnvironmentState lastState() {
        return observed.isEmpty() ? null : observed.get(observed.size() - 1);
    }
}
