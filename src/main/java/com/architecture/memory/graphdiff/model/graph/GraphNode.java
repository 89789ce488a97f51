package com.architecture.memory.graphdiff.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * A code entity (component, class, function, ...) within a snapshot.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class GraphNode implements GraphEntity {

    String id;
    String type;

    @Builder.Default
    Map<String, Object> data = Map.of();

    @Override
    @JsonIgnore
    public EntityKind getKind() {
        return EntityKind.NODE;
    }
}
