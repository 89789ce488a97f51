package com.architecture.memory.graphdiff.service.diff;

/**
 * Caller-supplied equality for a property, registered in {@link DiffOptions#getCustomComparators()}.
 * Returning {@code true} marks the two values as equivalent; the property is then not descended into.
 */
@FunctionalInterface
public interface ValueComparator {

    boolean equivalent(Object source, Object target);
}
