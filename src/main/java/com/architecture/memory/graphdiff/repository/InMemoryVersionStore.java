package com.architecture.memory.graphdiff.repository;

import com.architecture.memory.graphdiff.dto.diff.GraphDiff;
import com.architecture.memory.graphdiff.model.graph.GraphVersion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe {@link VersionStore} held in memory. Nothing is evicted.
 */
@Slf4j
@Repository
public class InMemoryVersionStore implements VersionStore {

    private static final Comparator<GraphVersion> NEWEST_FIRST = Comparator
            .comparing(GraphVersion::getTimestamp, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(GraphVersion::getId);

    private final Map<String, GraphVersion> versions = new ConcurrentHashMap<>();
    private final Map<String, GraphDiff> diffs = new ConcurrentHashMap<>();

    @Override
    public void storeVersion(GraphVersion version) {
        requireId(version.getId(), "version");
        GraphVersion previous = versions.put(version.getId(), version);
        if (previous != null) {
            log.debug("Replaced version {}", version.getId());
        } else {
            log.debug("Stored version {} ({} total)", version.getId(), versions.size());
        }
    }

    @Override
    public Optional<GraphVersion> findVersion(String versionId) {
        return versionId == null ? Optional.empty() : Optional.ofNullable(versions.get(versionId));
    }

    @Override
    public List<GraphVersion> getVersionHistory() {
        return versions.values().stream()
                .sorted(NEWEST_FIRST)
                .toList();
    }

    @Override
    public void storeDiff(GraphDiff diff) {
        requireId(diff.getId(), "diff");
        diffs.put(diff.getId(), diff);
        log.debug("Stored diff {} ({} total)", diff.getId(), diffs.size());
    }

    @Override
    public Optional<GraphDiff> findDiff(String diffId) {
        return diffId == null ? Optional.empty() : Optional.ofNullable(diffs.get(diffId));
    }

    @Override
    public int versionCount() {
        return versions.size();
    }

    @Override
    public int diffCount() {
        return diffs.size();
    }

    private static void requireId(String id, String what) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Cannot store a " + what + " without an id");
        }
    }
}
