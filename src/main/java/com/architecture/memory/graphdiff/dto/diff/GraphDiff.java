package com.architecture.memory.graphdiff.dto.diff;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Complete, immutable result of comparing two snapshots.
 */
@Value
@Builder(toBuilder = true)
public class GraphDiff {

    String id;
    String sourceVersion;
    String targetVersion;
    Instant timestamp;

    List<Change> changes;
    DiffStatistics statistics;
    List<Conflict> conflicts;

    public GraphDiff withVersions(String sourceVersion, String targetVersion) {
        return toBuilder()
                .sourceVersion(sourceVersion)
                .targetVersion(targetVersion)
                .build();
    }

    public boolean hasConflicts() {
        return conflicts != null && !conflicts.isEmpty();
    }
}
