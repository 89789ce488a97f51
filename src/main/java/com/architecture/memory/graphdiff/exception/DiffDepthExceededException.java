package com.architecture.memory.graphdiff.exception;

import lombok.Getter;

/**
 * Raised when value nesting exceeds the configured depth, which usually means a cyclic structure.
 */
@Getter
public class DiffDepthExceededException extends GraphDiffException {

    private final String path;
    private final int maxDepth;

    public DiffDepthExceededException(String path, int maxDepth) {
        super("Maximum diff depth " + maxDepth + " exceeded at '" + path
                + "' (cyclic or excessively nested data?)");
        this.path = path;
        this.maxDepth = maxDepth;
    }
}
