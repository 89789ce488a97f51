package com.architecture.memory.graphdiff.exception;

import lombok.Getter;

@Getter
public class VersionNotFoundException extends GraphDiffException {

    private final String versionId;

    public VersionNotFoundException(String versionId) {
        super("Version not found: " + versionId);
        this.versionId = versionId;
    }
}
