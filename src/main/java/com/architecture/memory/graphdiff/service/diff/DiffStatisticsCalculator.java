package com.architecture.memory.graphdiff.service.diff;

import com.architecture.memory.graphdiff.dto.diff.Change;
import com.architecture.memory.graphdiff.dto.diff.ChangeCategory;
import com.architecture.memory.graphdiff.dto.diff.ChangeImpact;
import com.architecture.memory.graphdiff.dto.diff.ChangeType;
import com.architecture.memory.graphdiff.dto.diff.DiffStatistics;
import com.architecture.memory.graphdiff.model.graph.GraphSnapshot;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Aggregates a change set into counters plus similarity and complexity ratios.
 *
 * similarity = 1 - distinctChangedEntities / unionSize
 * complexity = (structural or breaking changes) / unionSize
 * where unionSize = max(source entities, target entities).
 */
@Service
public class DiffStatisticsCalculator {

    public DiffStatistics calculate(List<Change> changes, GraphSnapshot source, GraphSnapshot target) {
        Map<ChangeType, Integer> counts = new EnumMap<>(ChangeType.class);
        for (Change change : changes) {
            counts.merge(change.getType(), 1, Integer::sum);
        }

        int unionSize = Math.max(source.size(), target.size());

        Set<String> changedEntities = changes.stream()
                .map(Change::getEntityId)
                .collect(Collectors.toSet());

        long heavyChanges = changes.stream()
                .filter(c -> c.getCategory() == ChangeCategory.STRUCTURAL || c.getImpact() == ChangeImpact.BREAKING)
                .count();

        double similarity = unionSize > 0 ? 1.0 - (double) changedEntities.size() / unionSize : 1.0;
        double complexity = unionSize > 0 ? (double) heavyChanges / unionSize : 0.0;

        return DiffStatistics.builder()
                .nodesAdded(counts.getOrDefault(ChangeType.NODE_ADDED, 0))
                .nodesRemoved(counts.getOrDefault(ChangeType.NODE_REMOVED, 0))
                .nodesModified(counts.getOrDefault(ChangeType.NODE_MODIFIED, 0))
                .edgesAdded(counts.getOrDefault(ChangeType.EDGE_ADDED, 0))
                .edgesRemoved(counts.getOrDefault(ChangeType.EDGE_REMOVED, 0))
                .edgesModified(counts.getOrDefault(ChangeType.EDGE_MODIFIED, 0))
                .totalChanges(changes.size())
                .similarity(clamp(similarity))
                .complexity(clamp(complexity))
                .build();
    }

    private static double clamp(double ratio) {
        return Math.max(0.0, Math.min(1.0, ratio));
    }
}
