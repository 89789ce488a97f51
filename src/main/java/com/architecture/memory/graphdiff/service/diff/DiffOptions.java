package com.architecture.memory.graphdiff.service.diff;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Per-comparison switches.
 *
 * Custom comparators are keyed either by dotted property path
 * (e.g. {@code data.position}) or by bare property name (e.g. {@code position});
 * the path key wins when both are registered.
 */
@Value
@Builder(toBuilder = true)
public class DiffOptions {

    boolean ignoreMetadata;
    boolean ignoreTimestamps;
    boolean semanticDiff;
    boolean includeConflictResolution;

    @Singular
    Map<String, ValueComparator> customComparators;

    // Reserved for context-aware diffing; carried but not used by the comparison.
    Integer contextWindow;

    public static DiffOptions defaults() {
        return DiffOptions.builder().build();
    }
}
