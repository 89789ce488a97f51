package com.architecture.memory.graphdiff.service.diff.filter;

import com.architecture.memory.graphdiff.dto.diff.ChangeCategory;
import com.architecture.memory.graphdiff.dto.diff.ChangeImpact;
import lombok.Builder;
import lombok.Value;

/**
 * Caller-registered override: changes matching {@code when} get the given
 * category and/or impact. A {@code null} override leaves that attribute alone.
 */
@Value
@Builder
public class ClassificationRule {
    String name;
    ChangeFilter when;
    ChangeCategory category;
    ChangeImpact impact;
}
