package com.aigent.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Declared capabilities of an agent, consumed by the selector when scoring candidates.
 *
 * @param supportedActionTypes  action types the agent can produce (e.g. "WeatherQuery")
 * @param skillLevels           skill name to level in [0.0, 1.0]
 * @param loadFactor            current load in [0.0, 1.0], lower means more available
 * @param historicalPerformance past performance score in [0.0, 1.0]
 */
public record AgentCapabilities(
    Set<String> supportedActionTypes,
    Map<String, Double> skillLevels,
    double loadFactor,
    double historicalPerformance
) {

    public AgentCapabilities {
        supportedActionTypes = supportedActionTypes == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(supportedActionTypes));
        skillLevels = skillLevels == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(skillLevels));
        requireUnit("loadFactor", loadFactor);
        requireUnit("historicalPerformance", historicalPerformance);
        for (var entry : skillLevels.entrySet()) {
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("Skill level for '" + entry.getKey() + "' must not be null");
            }
            requireUnit("skillLevels[" + entry.getKey() + "]", entry.getValue());
        }
    }

    public static AgentCapabilities none() {
        return new AgentCapabilities(Set.of(), Map.of(), 0.0, 0.0);
    }

    /**
     * Returns the level for the given skill, or 0.0 when the agent does not declare it.
     */
    public double skillLevel(String skill) {
        Double level = skill == null ? null : skillLevels.get(skill);
        return level != null ? level : 0.0;
    }

    private static void requireUnit(String field, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(field + " must be within [0.0, 1.0], got " + value);
        }
    }
}
