package com.architecture.memory.graphdiff.dto.diff;

import lombok.Builder;
import lombok.Value;

/**
 * Summary statistics for a graph diff.
 */
@Value
@Builder
public class DiffStatistics {
    int nodesAdded;
    int nodesRemoved;
    int nodesModified;
    int edgesAdded;
    int edgesRemoved;
    int edgesModified;
    int totalChanges;

    double similarity;      // 1 = identical
    double complexity;      // share of structural or breaking changes
}
