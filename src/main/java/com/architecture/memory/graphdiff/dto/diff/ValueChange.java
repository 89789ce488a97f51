package com.architecture.memory.graphdiff.dto.diff;

/**
 * Which sides of a property difference hold a value.
 */
public enum ValueChange {
    ADDED,      // absent in source
    REMOVED,    // absent in target
    CHANGED     // present on both sides
}
