package com.architecture.memory.graphdiff.exception;

import lombok.Getter;

@Getter
public class PatchIntegrityException extends GraphDiffException {

    private final String patchId;
    private final String expectedChecksum;
    private final String actualChecksum;

    public PatchIntegrityException(String patchId, String expectedChecksum, String actualChecksum) {
        super("Checksum mismatch for patch " + patchId + ": declared " + expectedChecksum
                + ", computed " + actualChecksum);
        this.patchId = patchId;
        this.expectedChecksum = expectedChecksum;
        this.actualChecksum = actualChecksum;
    }
}
