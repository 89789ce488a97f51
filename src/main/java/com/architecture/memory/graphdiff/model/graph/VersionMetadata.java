package com.architecture.memory.graphdiff.model.graph;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class VersionMetadata {
    String version;
    String branch;

    @Singular
    List<String> tags;

    @Singular
    List<String> parentVersions;
}
