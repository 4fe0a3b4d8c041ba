package com.aigent.core.agent;

/**
 * Thrown by an agent that cannot decide an action for the given environment.
 */
public class DecisionException extends Exception {
    public DecisionException(String message) {
        super(message);
    }

    public DecisionException(String message, Throwable cause) {
        super(message, cause);
    }
}
