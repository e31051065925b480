package com.flowgraph.core.output;

/**
 * Thrown when the run directory cannot be prepared. Aborts the batch before any job runs.
 */
public class OutputDirectoryException extends RuntimeException {

    public OutputDirectoryException(String message, Throwable cause) {
        super(message, cause);
    }

    public OutputDirectoryException(String message) {
        super(message);
    }
}
