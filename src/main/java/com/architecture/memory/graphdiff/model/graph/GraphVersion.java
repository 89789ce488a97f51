package com.architecture.memory.graphdiff.model.graph;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A named, authored snapshot kept in the version store.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class GraphVersion {

    String id;
    Instant timestamp;
    String author;
    String message;
    GraphSnapshot graph;

    @Builder.Default
    VersionMetadata metadata = VersionMetadata.builder().build();
}
