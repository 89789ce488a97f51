package com.architecture.memory.graphdiff.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * A directed relation between two nodes, identified by node ids.
 * Endpoints are not required to resolve inside the owning snapshot;
 * dangling endpoints are reported as conflicts when diffing.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class GraphEdge implements GraphEntity {

    String id;
    String source;
    String target;
    String type;

    @Builder.Default
    Map<String, Object> data = Map.of();

    @Override
    @JsonIgnore
    public EntityKind getKind() {
        return EntityKind.EDGE;
    }
}
