package com.architecture.memory.graphdiff.dto.diff;

public enum ChangeImpact {
    BREAKING,
    COMPATIBLE,
    ENHANCEMENT,
    COSMETIC
}
