package com.architecture.memory.graphdiff.dto.diff;

import lombok.Builder;
import lombok.Value;

/**
 * Advisory migration step attached to a breaking change. Never executed by the engine.
 */
@Value
@Builder
public class Migration {

    public enum Type {
        AUTOMATIC,
        MANUAL,
        DATA_TRANSFORM
    }

    Type type;
    String description;
    String code;
    String instructions;
}
