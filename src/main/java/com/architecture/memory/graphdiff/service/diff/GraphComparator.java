package com.architecture.memory.graphdiff.service.diff;

import com.architecture.memory.graphdiff.dto.diff.Change;
import com.architecture.memory.graphdiff.dto.diff.ChangeCategory;
import com.architecture.memory.graphdiff.dto.diff.ChangeImpact;
import com.architecture.memory.graphdiff.dto.diff.ChangeType;
import com.architecture.memory.graphdiff.dto.diff.SemanticChange;
import com.architecture.memory.graphdiff.dto.diff.ValueChange;
import com.architecture.memory.graphdiff.model.graph.GraphEdge;
import com.architecture.memory.graphdiff.model.graph.GraphEntity;
import com.architecture.memory.graphdiff.model.graph.GraphNode;
import com.architecture.memory.graphdiff.model.graph.GraphSnapshot;
import com.architecture.memory.graphdiff.service.DiffIdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes the raw change list between two snapshots.
 *
 * Entities are matched by id. Nodes are compared before edges; within each kind
 * the order is added (target order), removed (source order), modified (source order).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GraphComparator {

    static final String TYPE_PATH = "type";
    static final String CONNECTION_PATH = "connection";
    static final String DATA_PATH = "data";

    private final DeepObjectDiffer deepObjectDiffer;
    private final ChangeClassifier changeClassifier;
    private final DiffIdGenerator idGenerator;

    public List<Change> compare(GraphSnapshot source, GraphSnapshot target, DiffOptions options) {
        List<Change> changes = new ArrayList<>();

        diffNodes(source.nodesById(), target.nodesById(), changes, options);
        diffEdges(source.edgesById(), target.edgesById(), changes, options);

        log.debug("Compared {} -> {} entities, {} raw changes", source.size(), target.size(), changes.size());
        return changes;
    }

    // ========================= NODE DIFF =========================

    private void diffNodes(Map<String, GraphNode> sourceNodes, Map<String, GraphNode> targetNodes,
                           List<Change> changes, DiffOptions options) {
        for (Map.Entry<String, GraphNode> entry : targetNodes.entrySet()) {
            if (!sourceNodes.containsKey(entry.getKey())) {
                GraphNode node = entry.getValue();
                changes.add(Change.builder()
                        .id(idGenerator.generateChangeId())
                        .type(ChangeType.NODE_ADDED)
                        .entityId(node.getId())
                        .after(node)
                        .semantic(SemanticChange.builder()
                                .category(ChangeCategory.STRUCTURAL)
                                .impact(ChangeImpact.ENHANCEMENT)
                                .description("Added node " + node.getId() + " of type " + node.getType())
                                .build())
                        .build());
            }
        }

        for (Map.Entry<String, GraphNode> entry : sourceNodes.entrySet()) {
            if (!targetNodes.containsKey(entry.getKey())) {
                GraphNode node = entry.getValue();
                changes.add(Change.builder()
                        .id(idGenerator.generateChangeId())
                        .type(ChangeType.NODE_REMOVED)
                        .entityId(node.getId())
                        .before(node)
                        .semantic(SemanticChange.builder()
                                .category(ChangeCategory.STRUCTURAL)
                                .impact(ChangeImpact.BREAKING)
                                .description("Removed node " + node.getId() + " of type " + node.getType())
                                .build())
                        .build());
            }
        }

        for (Map.Entry<String, GraphNode> entry : sourceNodes.entrySet()) {
            GraphNode targetNode = targetNodes.get(entry.getKey());
            if (targetNode != null) {
                changes.addAll(compareNodeProperties(entry.getValue(), targetNode, options));
            }
        }
    }

    private List<Change> compareNodeProperties(GraphNode source, GraphNode target, DiffOptions options) {
        List<Change> changes = new ArrayList<>();

        if (!Objects.equals(source.getType(), target.getType())) {
            changes.add(typeChange(ChangeType.NODE_MODIFIED, source, target, List.of()));
        }

        changes.addAll(dataChanges(ChangeType.NODE_MODIFIED, source, target, List.of(), options));
        return changes;
    }

    // ========================= EDGE DIFF =========================

    private void diffEdges(Map<String, GraphEdge> sourceEdges, Map<String, GraphEdge> targetEdges,
                           List<Change> changes, DiffOptions options) {
        for (Map.Entry<String, GraphEdge> entry : targetEdges.entrySet()) {
            if (!sourceEdges.containsKey(entry.getKey())) {
                GraphEdge edge = entry.getValue();
                changes.add(Change.builder()
                        .id(idGenerator.generateChangeId())
                        .type(ChangeType.EDGE_ADDED)
                        .entityId(edge.getId())
                        .after(edge)
                        .semantic(SemanticChange.builder()
                                .category(ChangeCategory.STRUCTURAL)
                                .impact(ChangeImpact.ENHANCEMENT)
                                .description("Added edge " + edge.getId() + " from " + edge.getSource()
                                        + " to " + edge.getTarget())
                                .affectedRelations(endpoints(edge))
                                .build())
                        .build());
            }
        }

        for (Map.Entry<String, GraphEdge> entry : sourceEdges.entrySet()) {
            if (!targetEdges.containsKey(entry.getKey())) {
                GraphEdge edge = entry.getValue();
                changes.add(Change.builder()
                        .id(idGenerator.generateChangeId())
                        .type(ChangeType.EDGE_REMOVED)
                        .entityId(edge.getId())
                        .before(edge)
                        .semantic(SemanticChange.builder()
                                .category(ChangeCategory.STRUCTURAL)
                                .impact(ChangeImpact.BREAKING)
                                .description("Removed edge " + edge.getId() + " from " + edge.getSource()
                                        + " to " + edge.getTarget())
                                .affectedRelations(endpoints(edge))
                                .build())
                        .build());
            }
        }

        for (Map.Entry<String, GraphEdge> entry : sourceEdges.entrySet()) {
            GraphEdge targetEdge = targetEdges.get(entry.getKey());
            if (targetEdge != null) {
                changes.addAll(compareEdgeProperties(entry.getValue(), targetEdge, options));
            }
        }
    }

    private List<Change> compareEdgeProperties(GraphEdge source, GraphEdge target, DiffOptions options) {
        List<Change> changes = new ArrayList<>();
        List<String> relations = endpoints(source);

        if (!Objects.equals(source.getType(), target.getType())) {
            changes.add(typeChange(ChangeType.EDGE_MODIFIED, source, target, relations));
        }

        if (!Objects.equals(source.getSource(), target.getSource())
                || !Objects.equals(source.getTarget(), target.getTarget())) {
            List<String> affected = new ArrayList<>(relations);
            affected.addAll(endpoints(target));

            changes.add(Change.builder()
                    .id(idGenerator.generateChangeId())
                    .type(ChangeType.EDGE_MODIFIED)
                    .entityId(source.getId())
                    .before(source)
                    .after(target)
                    .path(List.of(CONNECTION_PATH))
                    .oldValue(connection(source))
                    .newValue(connection(target))
                    .valueChange(ValueChange.CHANGED)
                    .semantic(SemanticChange.builder()
                            .category(ChangeCategory.STRUCTURAL)
                            .impact(ChangeImpact.BREAKING)
                            .description("Changed edge connection from " + source.getSource() + "->"
                                    + source.getTarget() + " to " + target.getSource() + "->" + target.getTarget())
                            .affectedRelations(affected)
                            .build())
                    .build());
        }

        changes.addAll(dataChanges(ChangeType.EDGE_MODIFIED, source, target, relations, options));
        return changes;
    }

    // ========================= SHARED =========================

    private Change typeChange(ChangeType changeType, GraphEntity source, GraphEntity target,
                              List<String> relations) {
        String kind = source.getKind().name().toLowerCase();
        return Change.builder()
                .id(idGenerator.generateChangeId())
                .type(changeType)
                .entityId(source.getId())
                .before(source)
                .after(target)
                .path(List.of(TYPE_PATH))
                .oldValue(source.getType())
                .newValue(target.getType())
                .valueChange(ValueChange.CHANGED)
                .semantic(SemanticChange.builder()
                        .category(ChangeCategory.BEHAVIORAL)
                        .impact(ChangeImpact.BREAKING)
                        .description("Changed " + kind + " type from " + source.getType() + " to " + target.getType())
                        .affectedRelations(relations)
                        .build())
                .build();
    }

    private List<Change> dataChanges(ChangeType changeType, GraphEntity source, GraphEntity target,
                                     List<String> relations, DiffOptions options) {
        String kind = source.getKind().name().toLowerCase();
        List<PropertyDiff> diffs = deepObjectDiffer.diff(
                dataOf(source), dataOf(target), List.of(DATA_PATH), options);

        List<Change> changes = new ArrayList<>(diffs.size());
        for (PropertyDiff diff : diffs) {
            changes.add(Change.builder()
                    .id(idGenerator.generateChangeId())
                    .type(changeType)
                    .entityId(source.getId())
                    .before(source)
                    .after(target)
                    .path(diff.getPath())
                    .oldValue(diff.getOldValue())
                    .newValue(diff.getNewValue())
                    .valueChange(diff.getValueChange())
                    .semantic(SemanticChange.builder()
                            .category(ChangeCategory.DATA)
                            .impact(changeClassifier.dataImpact(diff))
                            .description("Modified " + kind + " data: " + diff.joinedPath())
                            .affectedRelations(relations)
                            .build())
                    .build());
        }
        return changes;
    }

    private static Map<String, Object> dataOf(GraphEntity entity) {
        return entity.getData() != null ? entity.getData() : Map.of();
    }

    private static List<String> endpoints(GraphEdge edge) {
        List<String> endpoints = new ArrayList<>(2);
        endpoints.add(edge.getSource());
        endpoints.add(edge.getTarget());
        return endpoints;
    }

    private static Map<String, Object> connection(GraphEdge edge) {
        Map<String, Object> connection = new LinkedHashMap<>();
        connection.put("source", edge.getSource());
        connection.put("target", edge.getTarget());
        return connection;
    }
}
