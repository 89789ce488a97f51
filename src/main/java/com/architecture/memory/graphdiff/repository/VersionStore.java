package com.architecture.memory.graphdiff.repository;

import com.architecture.memory.graphdiff.dto.diff.GraphDiff;
import com.architecture.memory.graphdiff.model.graph.GraphVersion;

import java.util.List;
import java.util.Optional;

/**
 * Keyed storage for graph versions and computed diffs.
 *
 * A store starts empty and keeps everything it is given for its own lifetime;
 * storing under an existing id replaces the previous entry.
 */
public interface VersionStore {

    void storeVersion(GraphVersion version);

    Optional<GraphVersion> findVersion(String versionId);

    /**
     * All stored versions, newest timestamp first.
     */
    List<GraphVersion> getVersionHistory();

    void storeDiff(GraphDiff diff);

    Optional<GraphDiff> findDiff(String diffId);

    int versionCount();

    int diffCount();
}
