package com.mof.tool.match;

/**
 * Thrown when no usable criterion is left after normalization.
 * This is a request for user correction, not an empty search.
 */
public class InvalidCriteriaException extends MatchException {

    public InvalidCriteriaException(String message) {
        super(message);
    }
}
