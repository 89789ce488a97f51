package com.architecture.memory.graphdiff.dto.patch;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Ordered, checksummed list of operations transforming one snapshot toward another.
 * Operation order is significant and covered by the checksum.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class GraphPatch {
    String id;
    String sourceVersion;
    String targetVersion;
    List<PatchOperation> operations;
    String checksum;
    PatchMetadata metadata;
}
