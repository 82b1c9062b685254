package com.mof.tool.match;

/**
 * Exception thrown when a match request cannot be executed.
 * Subclasses distinguish requests the user has to correct.
 */
public class MatchException extends RuntimeException {

    public MatchException(String message) {
        super(message);
    }

    public MatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
