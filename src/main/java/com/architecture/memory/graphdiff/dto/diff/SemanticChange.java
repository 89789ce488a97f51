package com.architecture.memory.graphdiff.dto.diff;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class SemanticChange {
    ChangeCategory category;
    ChangeImpact impact;
    String description;

    @Singular
    List<String> affectedRelations;   // node ids

    @Singular
    List<Migration> migrations;
}
