package com.architecture.memory.graphdiff.model.graph;

/**
 * Kind of graph entity a change or patch operation refers to.
 * The collection name doubles as the first segment of patch paths.
 */
public enum EntityKind {
    NODE("nodes"),
    EDGE("edges");

    private final String collection;

    EntityKind(String collection) {
        this.collection = collection;
    }

    public String getCollection() {
        return collection;
    }

    public static EntityKind fromCollection(String collection) {
        for (EntityKind kind : values()) {
            if (kind.collection.equals(collection)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown entity collection: " + collection);
    }
}
