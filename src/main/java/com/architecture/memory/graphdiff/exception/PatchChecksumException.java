package com.architecture.memory.graphdiff.exception;

public class PatchChecksumException extends GraphDiffException {

    public PatchChecksumException(String message, Throwable cause) {
        super(message, cause);
    }
}
