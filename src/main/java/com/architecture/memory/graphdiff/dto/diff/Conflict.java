package com.architecture.memory.graphdiff.dto.diff;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A structural inconsistency introduced by a change set taken as a whole.
 */
@Value
@Builder
public class Conflict {

    public enum Type {
        NODE_CONFLICT,
        EDGE_CONFLICT,
        STRUCTURAL_CONFLICT
    }

    public enum Severity {
        LOW,
        MEDIUM,
        HIGH,
        CRITICAL
    }

    String id;
    Type type;
    String description;

    @Singular
    List<String> entities;

    Severity severity;

    @Singular
    List<ConflictResolution> resolutionStrategies;
}
