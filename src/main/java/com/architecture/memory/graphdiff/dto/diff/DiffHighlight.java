package com.architecture.memory.graphdiff.dto.diff;

import com.architecture.memory.graphdiff.model.graph.EntityKind;
import lombok.Builder;
import lombok.Value;

/**
 * Per-change entry consumed by diff renderers.
 */
@Value
@Builder
public class DiffHighlight {
    String entityId;
    EntityKind entityType;
    ChangeType changeType;
    ChangeImpact impact;
    String color;           // hex, e.g. "#28a745"
    String description;
}
