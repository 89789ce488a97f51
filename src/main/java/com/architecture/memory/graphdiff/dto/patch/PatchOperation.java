package com.architecture.memory.graphdiff.dto.patch;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A single patch step. {@code path} and {@code from} use JSON Pointer syntax
 * rooted at the snapshot, e.g. {@code /nodes/user-service/data/port}.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PatchOperation {
    PatchOp op;
    String path;
    Object value;
    String from;    // move/copy only
}
