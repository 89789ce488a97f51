package com.architecture.memory.graphdiff;

import com.architecture.memory.graphdiff.model.graph.GraphEdge;
import com.architecture.memory.graphdiff.model.graph.GraphNode;
import com.architecture.memory.graphdiff.model.graph.GraphSnapshot;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Small builders for snapshots used across tests.
 */
public final class GraphFixtures {

    private GraphFixtures() {
    }

    public static GraphNode node(String id, String type) {
        return GraphNode.builder().id(id).type(type).build();
    }

    public static GraphNode node(String id, String type, Map<String, Object> data) {
        return GraphNode.builder().id(id).type(type).data(data).build();
    }

    public static GraphEdge edge(String id, String source, String target) {
        return edge(id, source, target, "calls");
    }

    public static GraphEdge edge(String id, String source, String target, String type) {
        return GraphEdge.builder().id(id).source(source).target(target).type(type).build();
    }

    public static GraphEdge edge(String id, String source, String target, String type, Map<String, Object> data) {
        return GraphEdge.builder().id(id).source(source).target(target).type(type).data(data).build();
    }

    public static GraphSnapshot snapshot(List<GraphNode> nodes, List<GraphEdge> edges) {
        return GraphSnapshot.builder().nodes(nodes).edges(edges).build();
    }

    /**
     * Ordered map from alternating keys and values; unlike {@link Map#of} it accepts nulls.
     */
    public static Map<String, Object> data(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs");
        }
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            data.put((String) keyValues[i], keyValues[i + 1]);
        }
        return data;
    }
}
