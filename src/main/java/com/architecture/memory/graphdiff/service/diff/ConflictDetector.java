package com.architecture.memory.graphdiff.service.diff;

import com.architecture.memory.graphdiff.dto.diff.Change;
import com.architecture.memory.graphdiff.dto.diff.ChangeAction;
import com.architecture.memory.graphdiff.dto.diff.ChangeType;
import com.architecture.memory.graphdiff.dto.diff.Conflict;
import com.architecture.memory.graphdiff.dto.diff.ConflictResolution;
import com.architecture.memory.graphdiff.model.graph.EntityKind;
import com.architecture.memory.graphdiff.model.graph.GraphEdge;
import com.architecture.memory.graphdiff.model.graph.GraphEntity;
import com.architecture.memory.graphdiff.model.graph.GraphSnapshot;
import com.architecture.memory.graphdiff.service.DiffIdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scans a change set for structural inconsistencies and proposes resolution options.
 *
 * Checks:
 * 1. Orphaned edges: edges in the target that still point at a removed node.
 * 2. Incompatible type transitions listed in the {@link TypeTransitionPolicy}.
 * 3. Duplicate entity ids in either snapshot (malformed input).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConflictDetector {

    private final TypeTransitionPolicy typeTransitionPolicy;
    private final DiffIdGenerator idGenerator;

    public List<Conflict> detectConflicts(List<Change> changes, GraphSnapshot source, GraphSnapshot target) {
        List<Conflict> conflicts = new ArrayList<>();

        List<String> orphanedEdges = detectOrphanedEdges(changes, target);
        if (!orphanedEdges.isEmpty()) {
            conflicts.add(orphanedEdgeConflict(orphanedEdges));
        }

        conflicts.addAll(detectTypeConflicts(changes));
        conflicts.addAll(detectDuplicateIds(source, "source"));
        conflicts.addAll(detectDuplicateIds(target, "target"));

        if (!conflicts.isEmpty()) {
            log.info("Detected {} conflicts", conflicts.size());
        }
        return conflicts;
    }

    // ========================= ORPHANED EDGES =========================

    /**
     * Edge ids whose new endpoints reference a removed node. Added and modified
     * edges come first in change order, followed by untouched target edges.
     */
    List<String> detectOrphanedEdges(List<Change> changes, GraphSnapshot target) {
        Set<String> removedNodes = changes.stream()
                .filter(c -> c.getType() == ChangeType.NODE_REMOVED)
                .map(Change::getEntityId)
                .collect(Collectors.toSet());

        if (removedNodes.isEmpty()) {
            return List.of();
        }

        Set<String> orphaned = new LinkedHashSet<>();
        for (Change change : changes) {
            if ((change.getType() == ChangeType.EDGE_ADDED || change.getType() == ChangeType.EDGE_MODIFIED)
                    && change.getAfter() instanceof GraphEdge edge
                    && referencesAny(edge, removedNodes)) {
                orphaned.add(change.getEntityId());
            }
        }

        if (target != null) {
            for (GraphEdge edge : target.getEdges()) {
                if (referencesAny(edge, removedNodes)) {
                    orphaned.add(edge.getId());
                }
            }
        }
        return new ArrayList<>(orphaned);
    }

    private static boolean referencesAny(GraphEdge edge, Set<String> nodeIds) {
        return nodeIds.contains(edge.getSource()) || nodeIds.contains(edge.getTarget());
    }

    private Conflict orphanedEdgeConflict(List<String> edgeIds) {
        return Conflict.builder()
                .id(idGenerator.generateConflictId())
                .type(Conflict.Type.STRUCTURAL_CONFLICT)
                .description("Edges referring to removed nodes")
                .entities(edgeIds)
                .severity(Conflict.Severity.HIGH)
                .resolutionStrategy(ConflictResolution.builder()
                        .strategy(ConflictResolution.Strategy.AUTO_RESOLVE)
                        .description("Automatically remove orphaned edges")
                        .confidence(0.9)
                        .build())
                .resolutionStrategy(ConflictResolution.builder()
                        .strategy(ConflictResolution.Strategy.MANUAL)
                        .description("Manually review and resolve")
                        .confidence(1.0)
                        .build())
                .build();
    }

    // ========================= TYPE TRANSITIONS =========================

    List<Conflict> detectTypeConflicts(List<Change> changes) {
        List<Conflict> conflicts = new ArrayList<>();

        for (Change change : changes) {
            if (change.getType().getAction() != ChangeAction.MODIFIED || !change.pathContains("type")) {
                continue;
            }
            if (!typeTransitionPolicy.isForbidden(change.getOldValue(), change.getNewValue())) {
                continue;
            }

            log.debug("Incompatible type transition on {}: {} -> {}",
                    change.getEntityId(), change.getOldValue(), change.getNewValue());

            conflicts.add(Conflict.builder()
                    .id(idGenerator.generateConflictId())
                    .type(change.getEntity() == EntityKind.NODE
                            ? Conflict.Type.NODE_CONFLICT
                            : Conflict.Type.EDGE_CONFLICT)
                    .description("Incompatible type change from " + change.getOldValue()
                            + " to " + change.getNewValue())
                    .entity(change.getEntityId())
                    .severity(Conflict.Severity.HIGH)
                    .resolutionStrategy(ConflictResolution.builder()
                            .strategy(ConflictResolution.Strategy.KEEP_SOURCE)
                            .description("Keep original type")
                            .confidence(0.5)
                            .result(change.getBefore())
                            .build())
                    .resolutionStrategy(ConflictResolution.builder()
                            .strategy(ConflictResolution.Strategy.KEEP_TARGET)
                            .description("Accept new type")
                            .confidence(0.5)
                            .result(change.getAfter())
                            .build())
                    .resolutionStrategy(ConflictResolution.builder()
                            .strategy(ConflictResolution.Strategy.MANUAL)
                            .description("Manual review required")
                            .confidence(1.0)
                            .build())
                    .build());
        }
        return conflicts;
    }

    // ========================= DUPLICATE IDS =========================

    private List<Conflict> detectDuplicateIds(GraphSnapshot snapshot, String side) {
        if (snapshot == null) {
            return List.of();
        }
        List<Conflict> conflicts = new ArrayList<>();
        duplicateConflict(duplicates(snapshot.getNodes()), "node", side).ifPresent(conflicts::add);
        duplicateConflict(duplicates(snapshot.getEdges()), "edge", side).ifPresent(conflicts::add);
        return conflicts;
    }

    private static List<String> duplicates(List<? extends GraphEntity> entities) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (GraphEntity entity : entities) {
            if (!seen.add(entity.getId())) {
                duplicates.add(entity.getId());
            }
        }
        return new ArrayList<>(duplicates);
    }

    private Optional<Conflict> duplicateConflict(List<String> ids, String kind, String side) {
        if (ids.isEmpty()) {
            return Optional.empty();
        }
        log.warn("Duplicate {} ids in {} snapshot: {}", kind, side, ids);
        return Optional.of(Conflict.builder()
                .id(idGenerator.generateConflictId())
                .type(Conflict.Type.STRUCTURAL_CONFLICT)
                .description("Duplicate " + kind + " ids in " + side + " snapshot; only the first occurrence is compared")
                .entities(ids)
                .severity(Conflict.Severity.MEDIUM)
                .resolutionStrategy(ConflictResolution.builder()
                        .strategy(ConflictResolution.Strategy.MANUAL)
                        .description("Deduplicate ids in the " + side + " snapshot")
                        .confidence(1.0)
                        .build())
                .build());
    }
}
