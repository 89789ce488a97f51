package com.architecture.memory.graphdiff.model.graph;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Point-in-time state of a graph: node and edge lists with ids unique per list.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class GraphSnapshot {

    @Singular
    List<GraphNode> nodes;

    @Singular
    List<GraphEdge> edges;

    public static GraphSnapshot empty() {
        return GraphSnapshot.builder().build();
    }

    /**
     * Nodes indexed by id in snapshot order. For duplicate ids the first occurrence wins.
     */
    public Map<String, GraphNode> nodesById() {
        return index(nodes);
    }

    /**
     * Edges indexed by id in snapshot order. For duplicate ids the first occurrence wins.
     */
    public Map<String, GraphEdge> edgesById() {
        return index(edges);
    }

    public int size() {
        return nodes.size() + edges.size();
    }

    private static <T extends GraphEntity> Map<String, T> index(List<T> entities) {
        return entities.stream()
                .collect(Collectors.toMap(
                        GraphEntity::getId,
                        Function.identity(),
                        (a, b) -> a,
                        LinkedHashMap::new));
    }
}
