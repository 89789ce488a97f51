package com.architecture.memory.graphdiff.exception;

import com.architecture.memory.graphdiff.dto.patch.PatchOperation;
import com.architecture.memory.graphdiff.model.graph.GraphSnapshot;

public class PatchTargetNotFoundException extends PatchApplicationException {

    public PatchTargetNotFoundException(String message, int operationIndex, PatchOperation operation,
                                        GraphSnapshot partialResult) {
        super(message, operationIndex, operation, partialResult);
    }
}
