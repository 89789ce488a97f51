package com.architecture.memory.graphdiff.dto.patch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Primitive patch operations, serialized in lower case ({@code "add"}, {@code "replace"}, ...).
 */
public enum PatchOp {
    ADD,
    REMOVE,
    REPLACE,
    MOVE,
    COPY,
    TEST;

    @JsonValue
    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PatchOp fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Patch op is required");
        }
        return valueOf(name.toUpperCase(Locale.ROOT));
    }
}
