package com.aigent.core.registry;

import com.aigent.core.agent.Agent;
import com.aigent.core.model.AgentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Holds the agents currently available to the orchestrator.
 * <p>
 * Registration is idempotent on agent ID: re-registering replaces the previous instance but
 * keeps its original registration slot, so iteration order is always first-registration
 * order. The selector relies on that order for deterministic tie-breaks.
 * All reads return copied snapshots taken under the read lock.
 */
@Service
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Map<String, Agent> agents = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Adds or replaces an agent.
     *
     * @return the agent previously registered under the same ID, if any
     */
    public Optional<Agent> register(Agent agent) {
        Objects.requireNonNull(agent, "agent");
        Objects.requireNonNull(agent.id(), "agent id");
        lock.writeLock().lock();
        try {
            Agent previous = agents.put(agent.id(), agent);
            if (previous != null && previous != agent) {
                log.debug("Replaced agent {} ({} -> {})", agent.id(), previous.name(), agent.name());
            }
            return Optional.ofNullable(previous);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes an agent. Unknown IDs are a logged no-op.
     *
     * @return true if an agent was removed
     */
    public boolean unregister(String agentId) {
        if (agentId == null) {
            log.warn("Ignoring unregister request with null agent id");
            return false;
        }
        Agent removed;
        lock.writeLock().lock();
        try {
            removed = agents.remove(agentId);
        } finally {
            lock.writeLock().unlock();
        }
        if (removed == null) {
            log.warn("Attempted to unregister unknown agent: {}", agentId);
            return false;
        }
        return true;
    }

    public List<Agent> agentsOfType(AgentType type) {
        lock.readLock().lock();
        try {
            var matching = new ArrayList<Agent>();
            for (var agent : agents.values()) {
                if (agent.type() == type) {
                    matching.add(agent);
                }
            }
            return List.copyOf(matching);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Agent> find(String agentId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(agents.get(agentId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Agent> all() {
        lock.readLock().lock();
        try {
            return List.copyOf(agents.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return agents.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
