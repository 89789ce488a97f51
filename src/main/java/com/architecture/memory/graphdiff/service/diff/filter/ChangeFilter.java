package com.architecture.memory.graphdiff.service.diff.filter;

import com.architecture.memory.graphdiff.dto.diff.Change;

/**
 * A typed predicate over changes. Filters are built from {@link ChangeFilters}
 * and form an expression tree; nothing is compiled from strings at runtime.
 */
public interface ChangeFilter {

    boolean test(Change change);

    default ChangeFilter and(ChangeFilter other) {
        return ChangeFilters.allOf(this, other);
    }

    default ChangeFilter or(ChangeFilter other) {
        return ChangeFilters.anyOf(this, other);
    }

    default ChangeFilter negate() {
        return ChangeFilters.not(this);
    }
}
