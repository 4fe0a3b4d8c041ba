package com.aigent.core.selection;

/**
 * Thrown when agent selection has no candidate to choose from.
 */
public class NoCandidateException extends RuntimeException {
    public NoCandidateException(String message) {
        super(message);
    }
}
