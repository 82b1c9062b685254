package com.mof.tool.dataset;

/**
 * Exception thrown when a dataset cannot be read.
 * Wraps underlying IO or parsing exceptions.
 */
public class DatasetException extends RuntimeException {

    public DatasetException(String message) {
        super(message);
    }

    public DatasetException(String message, Throwable cause) {
        super(message, cause);
    }
}
