package com.architecture.memory.graphdiff.service.diff;

import com.architecture.memory.graphdiff.dto.diff.ValueChange;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A leaf difference found by {@link DeepObjectDiffer}.
 */
@Value
@Builder
public class PropertyDiff {
    List<String> path;
    Object oldValue;
    Object newValue;
    ValueChange valueChange;

    public String joinedPath() {
        return String.join(".", path);
    }
}
