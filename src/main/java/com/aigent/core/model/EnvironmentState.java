package com.aigent.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of the environment an agent reasons over when deciding its next action.
 * Built from a step's parameters plus the outputs of its dependencies.
 *
 * @param properties read-only property map; values may be {@code null}
 * @param timestamp  when the snapshot was taken
 */
public record EnvironmentState(
    Map<String, Object> properties,
    Instant timestamp
) {

    /** Prefix under which dependency outputs are injected into the snapshot. */
    public static final String DEPENDENCY_PREFIX = "dep_";

    public EnvironmentState {
        properties = properties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static EnvironmentState of(Map<String, Object> properties) {
        return new EnvironmentState(properties, Instant.now());
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(properties.get(key));
    }

    public Optional<String> getString(String key) {
        Object value = properties.get(key);
        return value instanceof String s ? Optional.of(s) : Optional.empty();
    }

    /**
     * Returns the output of the named dependency, if it was injected into this snapshot.
     */
    public Optional<ActionResult> dependency(String stepName) {
        Object value = properties.get(DEPENDENCY_PREFIX + stepName);
        return value instanceof ActionResult r ? Optional.of(r) : Optional.empty();
    }
}
