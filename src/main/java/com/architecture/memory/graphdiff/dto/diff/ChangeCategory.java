package com.architecture.memory.graphdiff.dto.diff;

public enum ChangeCategory {
    STRUCTURAL,
    DATA,
    METADATA,
    BEHAVIORAL
}
