package com.architecture.memory.graphdiff.dto.patch;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@Jacksonized
public class PatchMetadata {
    Instant createdAt;
    String createdBy;
    String description;

    // Ids of changes that could not be expressed as operations
    @Singular
    List<String> skippedChanges;
}
