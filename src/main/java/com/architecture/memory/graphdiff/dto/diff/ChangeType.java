package com.architecture.memory.graphdiff.dto.diff;

import com.architecture.memory.graphdiff.model.graph.EntityKind;

/**
 * The six change variants. Consumers switch over this enum exhaustively.
 */
public enum ChangeType {
    NODE_ADDED(EntityKind.NODE, ChangeAction.ADDED),
    NODE_REMOVED(EntityKind.NODE, ChangeAction.REMOVED),
    NODE_MODIFIED(EntityKind.NODE, ChangeAction.MODIFIED),
    EDGE_ADDED(EntityKind.EDGE, ChangeAction.ADDED),
    EDGE_REMOVED(EntityKind.EDGE, ChangeAction.REMOVED),
    EDGE_MODIFIED(EntityKind.EDGE, ChangeAction.MODIFIED);

    private final EntityKind entity;
    private final ChangeAction action;

    ChangeType(EntityKind entity, ChangeAction action) {
        this.entity = entity;
        this.action = action;
    }

    public EntityKind getEntity() {
        return entity;
    }

    public ChangeAction getAction() {
        return action;
    }

    public static ChangeType of(EntityKind entity, ChangeAction action) {
        for (ChangeType type : values()) {
            if (type.entity == entity && type.action == action) {
                return type;
            }
        }
        throw new IllegalArgumentException("No change type for " + entity + "/" + action);
    }
}
