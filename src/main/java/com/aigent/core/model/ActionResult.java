package com.aigent.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of executing an action.
 *
 * @param success   whether the action achieved its goal
 * @param message   human-readable outcome or failure reason
 * @param data      auxiliary payload produced by the action
 * @param timestamp when the result was produced
 */
public record ActionResult(
    boolean success,
    String message,
    Map<String, Object> data,
    Instant timestamp
) {

    public ActionResult {
        data = data == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static ActionResult succeeded(String message) {
        return new ActionResult(true, message, Map.of(), Instant.now());
    }

    public static ActionResult succeeded(String message, Map<String, Object> data) {
        return new ActionResult(true, message, data, Instant.now());
    }

    public static ActionResult failed(String message) {
        return new ActionResult(false, message, Map.of(), Instant.now());
    }
}
