package com.architecture.memory.graphdiff.exception;

/**
 * Base type for all failures raised by the diff engine.
 */
public class GraphDiffException extends RuntimeException {

    public GraphDiffException(String message) {
        super(message);
    }

    public GraphDiffException(String message, Throwable cause) {
        super(message, cause);
    }
}
