package com.aigent.core.agent;

/**
 * Thrown by an agent when a decided action could not be carried out.
 */
public class ActionExecutionException extends Exception {
    public ActionExecutionException(String message) {
        super(message);
    }

    public ActionExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
