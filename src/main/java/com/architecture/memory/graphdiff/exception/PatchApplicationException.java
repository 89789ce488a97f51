package com.architecture.memory.graphdiff.exception;

import com.architecture.memory.graphdiff.dto.patch.PatchOperation;
import com.architecture.memory.graphdiff.model.graph.GraphSnapshot;
import lombok.Getter;

/**
 * A patch operation could not be applied. Operations before {@code operationIndex}
 * were applied; {@code partialResult} holds the working copy at the point of failure.
 */
@Getter
public class PatchApplicationException extends GraphDiffException {

    private final int operationIndex;
    private final PatchOperation operation;
    private final GraphSnapshot partialResult;

    public PatchApplicationException(String message, int operationIndex, PatchOperation operation,
                                     GraphSnapshot partialResult) {
        super("Patch operation #" + operationIndex + " failed: " + message);
        this.operationIndex = operationIndex;
        this.operation = operation;
        this.partialResult = partialResult;
    }
}
