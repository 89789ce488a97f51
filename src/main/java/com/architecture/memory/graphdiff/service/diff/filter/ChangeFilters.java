package com.architecture.memory.graphdiff.service.diff.filter;

import com.architecture.memory.graphdiff.dto.diff.Change;
import com.architecture.memory.graphdiff.dto.diff.ChangeAction;
import com.architecture.memory.graphdiff.dto.diff.ChangeCategory;
import com.architecture.memory.graphdiff.dto.diff.ChangeImpact;
import com.architecture.memory.graphdiff.dto.diff.ChangeType;
import com.architecture.memory.graphdiff.model.graph.EntityKind;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Factory for {@link ChangeFilter} expressions.
 *
 * <pre>
 * ChangeFilter breakingEdges = ChangeFilters.entity(EntityKind.EDGE)
 *         .and(ChangeFilters.impact(ChangeImpact.BREAKING));
 * </pre>
 */
public final class ChangeFilters {

    private ChangeFilters() {
    }

    public static ChangeFilter any() {
        return new Always();
    }

    public static ChangeFilter entity(EntityKind kind) {
        return new EntityIs(kind);
    }

    public static ChangeFilter changeType(ChangeType first, ChangeType... rest) {
        return new TypeIn(EnumSet.of(first, rest));
    }

    public static ChangeFilter action(ChangeAction action) {
        return new ActionIs(action);
    }

    public static ChangeFilter impact(ChangeImpact first, ChangeImpact... rest) {
        return new ImpactIn(EnumSet.of(first, rest));
    }

    public static ChangeFilter category(ChangeCategory first, ChangeCategory... rest) {
        return new CategoryIn(EnumSet.of(first, rest));
    }

    public static ChangeFilter pathContains(String segment) {
        return new PathContains(segment);
    }

    public static ChangeFilter entityId(String... ids) {
        return new EntityIdIn(Set.of(ids));
    }

    public static ChangeFilter allOf(ChangeFilter... filters) {
        return new AllOf(List.of(filters));
    }

    public static ChangeFilter anyOf(ChangeFilter... filters) {
        return new AnyOf(List.of(filters));
    }

    public static ChangeFilter not(ChangeFilter filter) {
        return new Not(filter);
    }

    /**
     * Leaf backed by a predicate registered ahead of time. The name shows up in logs.
     */
    public static ChangeFilter predicate(String name, Predicate<Change> predicate) {
        return new Named(name, predicate);
    }

    record Always() implements ChangeFilter {
        @Override
        public boolean test(Change change) {
            return true;
        }
    }

    record EntityIs(EntityKind kind) implements ChangeFilter {
        @Override
        public boolean test(Change change) {
            return change.getEntity() == kind;
        }
    }

    record TypeIn(Set<ChangeType> types) implements ChangeFilter {
        @Override
        public boolean test(Change change) {
            return types.contains(change.getType());
        }
    }

    record ActionIs(ChangeAction action) implements ChangeFilter {
        @Override
        public boolean test(Change change) {
            return change.getType().getAction() == action;
        }
    }

    record ImpactIn(Set<ChangeImpact> impacts) implements ChangeFilter {
        @Override
        public boolean test(Change change) {
            return impacts.contains(change.getImpact());
        }
    }

    record CategoryIn(Set<ChangeCategory> categories) implements ChangeFilter {
        @Override
        public boolean test(Change change) {
            return categories.contains(change.getCategory());
        }
    }

    record PathContains(String segment) implements ChangeFilter {
        @Override
        public boolean test(Change change) {
            return change.pathContains(segment);
        }
    }

    record EntityIdIn(Set<String> ids) implements ChangeFilter {
        @Override
        public boolean test(Change change) {
            return ids.contains(change.getEntityId());
        }
    }

    record AllOf(List<ChangeFilter> filters) implements ChangeFilter {
        @Override
        public boolean test(Change change) {
            return filters.stream().allMatch(f -> f.test(change));
        }
    }

    record AnyOf(List<ChangeFilter> filters) implements ChangeFilter {
        @Override
        public boolean test(Change change) {
            return filters.stream().anyMatch(f -> f.test(change));
        }
    }

    record Not(ChangeFilter filter) implements ChangeFilter {
        @Override
        public boolean test(Change change) {
            return !filter.test(change);
        }
    }

    record Named(String name, Predicate<Change> predicate) implements ChangeFilter {
        @Override
        public boolean test(Change change) {
            return predicate.test(change);
        }

        @Override
        public String toString() {
            return "Named[" + name + "]";
        }
    }
}
