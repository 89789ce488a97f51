package com.architecture.memory.graphdiff.service.diff;

import com.architecture.memory.graphdiff.config.GraphDiffProperties;
import com.architecture.memory.graphdiff.dto.diff.ValueChange;
import com.architecture.memory.graphdiff.exception.DiffDepthExceededException;
import com.architecture.memory.graphdiff.service.diff.JsonValues.Shape;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Recursive comparison of arbitrary JSON-shaped values, producing path-tagged leaf differences.
 *
 * Rules:
 * - Different shapes (including null vs. non-null) give one difference at the current path.
 * - Lists of different length give one difference at the list path; equal lengths recurse per index.
 * - Maps recurse over the union of keys; a key present on one side only gives an ADDED/REMOVED difference.
 *
 * Nesting is bounded by {@code graph-diff.max-depth}; hitting the bound is fatal.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DeepObjectDiffer {

    static final Set<String> METADATA_FIELDS = Set.of("metadata", "createdAt", "updatedAt", "version");
    static final Set<String> TIMESTAMP_FIELDS = Set.of("timestamp", "createdAt", "updatedAt", "lastModified");

    private final GraphDiffProperties properties;

    private final AtomicLong comparatorFailures = new AtomicLong();

    /**
     * Compare two values and return every leaf difference, paths prefixed with {@code basePath}.
     */
    public List<PropertyDiff> diff(Object source, Object target, List<String> basePath, DiffOptions options) {
        List<PropertyDiff> diffs = new ArrayList<>();
        compare(source, target, List.copyOf(basePath), options, diffs, 0);
        return diffs;
    }

    /**
     * Number of custom comparator invocations that threw and were ignored.
     */
    public long getComparatorFailureCount() {
        return comparatorFailures.get();
    }

    private void compare(Object source, Object target, List<String> path, DiffOptions options,
                         List<PropertyDiff> diffs, int depth) {
        if (depth > properties.getMaxDepth()) {
            throw new DiffDepthExceededException(String.join(".", path), properties.getMaxDepth());
        }

        Shape sourceShape = JsonValues.shapeOf(source);
        Shape targetShape = JsonValues.shapeOf(target);

        if (sourceShape != targetShape) {
            diffs.add(changed(path, source, target));
            return;
        }

        switch (sourceShape) {
            case NULL -> {
                // both null
            }
            case OBJECT -> compareMaps(JsonValues.asMap(source), JsonValues.asMap(target),
                    path, options, diffs, depth);
            case ARRAY -> compareLists(JsonValues.asList(source), JsonValues.asList(target),
                    path, options, diffs, depth);
            default -> {
                if (!JsonValues.scalarEquals(source, target)) {
                    diffs.add(changed(path, source, target));
                }
            }
        }
    }

    private void compareLists(List<Object> source, List<Object> target, List<String> path,
                              DiffOptions options, List<PropertyDiff> diffs, int depth) {
        if (source.size() != target.size()) {
            diffs.add(changed(path, source, target));
            return;
        }
        for (int i = 0; i < source.size(); i++) {
            compare(source.get(i), target.get(i), append(path, Integer.toString(i)), options, diffs, depth + 1);
        }
    }

    private void compareMaps(Map<String, Object> source, Map<String, Object> target, List<String> path,
                             DiffOptions options, List<PropertyDiff> diffs, int depth) {
        Set<String> allKeys = new LinkedHashSet<>(source.keySet());
        allKeys.addAll(target.keySet());

        for (String key : allKeys) {
            if (isIgnored(key, options)) {
                continue;
            }

            List<String> childPath = append(path, key);

            if (!source.containsKey(key)) {
                diffs.add(PropertyDiff.builder()
                        .path(childPath)
                        .newValue(target.get(key))
                        .valueChange(ValueChange.ADDED)
                        .build());
            } else if (!target.containsKey(key)) {
                diffs.add(PropertyDiff.builder()
                        .path(childPath)
                        .oldValue(source.get(key))
                        .valueChange(ValueChange.REMOVED)
                        .build());
            } else {
                Object sourceValue = source.get(key);
                Object targetValue = target.get(key);

                Optional<Boolean> custom = applyCustomComparator(childPath, key, sourceValue, targetValue, options);
                if (custom.isPresent()) {
                    if (!custom.get()) {
                        diffs.add(changed(childPath, sourceValue, targetValue));
                    }
                    continue;
                }

                compare(sourceValue, targetValue, childPath, options, diffs, depth + 1);
            }
        }
    }

    private boolean isIgnored(String key, DiffOptions options) {
        if (options.isIgnoreMetadata() && METADATA_FIELDS.contains(key)) {
            return true;
        }
        return options.isIgnoreTimestamps() && TIMESTAMP_FIELDS.contains(key);
    }

    /**
     * Looks up a comparator by dotted path, then by key. Empty when none applies or the comparator fails.
     */
    private Optional<Boolean> applyCustomComparator(List<String> path, String key, Object source, Object target,
                                                    DiffOptions options) {
        Map<String, ValueComparator> comparators = options.getCustomComparators();
        if (comparators == null || comparators.isEmpty()) {
            return Optional.empty();
        }

        String joinedPath = String.join(".", path);
        ValueComparator comparator = comparators.get(joinedPath);
        if (comparator == null) {
            comparator = comparators.get(key);
        }
        if (comparator == null) {
            return Optional.empty();
        }

        try {
            return Optional.of(comparator.equivalent(source, target));
        } catch (RuntimeException e) {
            comparatorFailures.incrementAndGet();
            log.warn("Custom comparator for '{}' failed, falling back to default comparison: {}",
                    joinedPath, e.getMessage());
            return Optional.empty();
        }
    }

    private static PropertyDiff changed(List<String> path, Object source, Object target) {
        return PropertyDiff.builder()
                .path(path)
                .oldValue(source)
                .newValue(target)
                .valueChange(ValueChange.CHANGED)
                .build();
    }

    private static List<String> append(List<String> path, String segment) {
        List<String> child = new ArrayList<>(path.size() + 1);
        child.addAll(path);
        child.add(segment);
        return List.copyOf(child);
    }
}
