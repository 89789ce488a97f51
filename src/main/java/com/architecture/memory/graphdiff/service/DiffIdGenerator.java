package com.architecture.memory.graphdiff.service;

import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Generates identifiers for diffs, changes, conflicts and patches.
 *
 * Format: {prefix}_{epochMillis}_{8 hex chars}, e.g. {@code diff_1718000000000_3f2a9c1b}.
 * Ids are unique, not deterministic; determinism is only required of patch checksums,
 * which do not cover ids.
 */
@Component
public class DiffIdGenerator {

    public String generateDiffId() {
        return generate("diff");
    }

    public String generateChangeId() {
        return generate("change");
    }

    public String generateConflictId() {
        return generate("conflict");
    }

    public String generatePatchId() {
        return generate("patch");
    }

    private String generate(String prefix) {
        return String.format("%s_%d_%s", prefix, System.currentTimeMillis(),
                UUID.randomUUID().toString().substring(0, 8));
    }
}
