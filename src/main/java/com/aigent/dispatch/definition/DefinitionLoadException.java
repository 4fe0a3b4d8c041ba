package com.aigent.dispatch.definition;

/**
 * A definition file is missing, unreadable or does not describe a valid workflow or agent.
 */
public class DefinitionLoadException extends RuntimeException {

    public DefinitionLoadException(String message) {
        super(message);
    }

    public DefinitionLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
