package com.aigent.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An action an agent has decided to take.
 *
 * @param type        action type (matched against {@link AgentCapabilities#supportedActionTypes()})
 * @param description human-readable summary of the action
 * @param parameters  action arguments
 */
public record Action(
    String type,
    String description,
    Map<String, Object> parameters
) {

    public Action {
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static Action of(String type, String description) {
        return new Action(type, description, Map.of());
    }
}
