package com.architecture.memory.graphdiff.dto.diff;

import com.architecture.memory.graphdiff.model.graph.EntityKind;
import com.architecture.memory.graphdiff.model.graph.GraphEntity;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A single detected difference between two snapshots.
 *
 * Added changes carry only {@code after}, removed changes only {@code before};
 * modified changes carry both plus the property {@code path} that differs.
 * {@code valueChange} tells whether {@code oldValue}/{@code newValue} are real
 * values or stand for an absent property.
 */
@Value
@Builder(toBuilder = true)
public class Change {

    String id;
    ChangeType type;
    String entityId;

    GraphEntity before;
    GraphEntity after;

    List<String> path;
    Object oldValue;
    Object newValue;
    ValueChange valueChange;

    SemanticChange semantic;

    public EntityKind getEntity() {
        return type.getEntity();
    }

    public boolean hasPath() {
        return path != null && !path.isEmpty();
    }

    public boolean pathContains(String segment) {
        return path != null && path.contains(segment);
    }

    public boolean hasNewValue() {
        return valueChange != ValueChange.REMOVED;
    }

    @JsonIgnore
    public ChangeImpact getImpact() {
        return semantic != null ? semantic.getImpact() : null;
    }

    @JsonIgnore
    public ChangeCategory getCategory() {
        return semantic != null ? semantic.getCategory() : null;
    }
}
