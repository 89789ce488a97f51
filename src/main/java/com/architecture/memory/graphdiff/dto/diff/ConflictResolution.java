package com.architecture.memory.graphdiff.dto.diff;

import com.architecture.memory.graphdiff.model.graph.GraphEntity;
import lombok.Builder;
import lombok.Value;

/**
 * One candidate way to resolve a conflict. Choosing among them is left to the caller.
 */
@Value
@Builder
public class ConflictResolution {

    public enum Strategy {
        KEEP_SOURCE,
        KEEP_TARGET,
        MERGE,
        MANUAL,
        AUTO_RESOLVE
    }

    Strategy strategy;
    String description;
    double confidence;      // 0..1
    GraphEntity result;
}
