package com.architecture.memory.graphdiff.model.graph;

import java.util.Map;

/**
 * Common view over nodes and edges. Entities reference each other by id only.
 */
public interface GraphEntity {

    String getId();

    String getType();

    Map<String, Object> getData();

    EntityKind getKind();
}
