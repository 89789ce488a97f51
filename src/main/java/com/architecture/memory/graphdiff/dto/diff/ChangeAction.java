package com.architecture.memory.graphdiff.dto.diff;

public enum ChangeAction {
    ADDED,
    REMOVED,
    MODIFIED
}
