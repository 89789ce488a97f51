package com.architecture.memory.graphdiff.service;

import com.architecture.memory.graphdiff.config.GraphDiffProperties;
import com.architecture.memory.graphdiff.dto.diff.Change;
import com.architecture.memory.graphdiff.dto.diff.Conflict;
import com.architecture.memory.graphdiff.dto.diff.DiffHighlight;
import com.architecture.memory.graphdiff.dto.diff.DiffStatistics;
import com.architecture.memory.graphdiff.dto.diff.GraphDiff;
import com.architecture.memory.graphdiff.dto.patch.GraphPatch;
import com.architecture.memory.graphdiff.exception.VersionNotFoundException;
import com.architecture.memory.graphdiff.model.graph.GraphSnapshot;
import com.architecture.memory.graphdiff.model.graph.GraphVersion;
import com.architecture.memory.graphdiff.repository.VersionStore;
import com.architecture.memory.graphdiff.service.diff.ChangeClassifier;
import com.architecture.memory.graphdiff.service.diff.ConflictDetector;
import com.architecture.memory.graphdiff.service.diff.DiffOptions;
import com.architecture.memory.graphdiff.service.diff.DiffStatisticsCalculator;
import com.architecture.memory.graphdiff.service.diff.GraphComparator;
import com.architecture.memory.graphdiff.service.diff.filter.ChangeFilter;
import com.architecture.memory.graphdiff.service.patch.PatchApplier;
import com.architecture.memory.graphdiff.service.patch.PatchCompiler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point of the engine: compares snapshots or stored versions, compiles and
 * replays patches, and keeps versions and diffs in the {@link VersionStore}.
 *
 * Every computed diff is registered in the store under its id.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GraphDiffingService {

    static final String SOURCE_LABEL = "source";
    static final String TARGET_LABEL = "target";

    static final String COLOR_ADDED = "#28a745";
    static final String COLOR_REMOVED = "#dc3545";
    static final String COLOR_MODIFIED = "#ffc107";

    private final GraphComparator graphComparator;
    private final ChangeClassifier changeClassifier;
    private final ConflictDetector conflictDetector;
    private final DiffStatisticsCalculator statisticsCalculator;
    private final PatchCompiler patchCompiler;
    private final PatchApplier patchApplier;
    private final VersionStore versionStore;
    private final DiffIdGenerator idGenerator;
    private final GraphDiffProperties properties;
    private final DiffOptions defaultDiffOptions;

    private final AtomicLong filterFailures = new AtomicLong();

    // ========================= COMPARISON =========================

    public GraphDiff compareGraphs(GraphSnapshot source, GraphSnapshot target) {
        return compareGraphs(source, target, defaultDiffOptions);
    }

    /**
     * Full pipeline: raw changes, classification, conflicts (when enabled) and statistics.
     */
    public GraphDiff compareGraphs(GraphSnapshot source, GraphSnapshot target, DiffOptions options) {
        DiffOptions effective = options != null ? options : defaultDiffOptions;
        log.info("Computing diff: {} -> {} entities (semantic={})",
                source.size(), target.size(), effective.isSemanticDiff());

        List<Change> changes = graphComparator.compare(source, target, effective);
        changes = changeClassifier.classify(changes, source, target, effective);

        List<Conflict> conflicts = effective.isIncludeConflictResolution()
                ? conflictDetector.detectConflicts(changes, source, target)
                : List.of();

        DiffStatistics statistics = statisticsCalculator.calculate(changes, source, target);

        GraphDiff diff = GraphDiff.builder()
                .id(idGenerator.generateDiffId())
                .sourceVersion(SOURCE_LABEL)
                .targetVersion(TARGET_LABEL)
                .timestamp(Instant.now())
                .changes(List.copyOf(changes))
                .statistics(statistics)
                .conflicts(List.copyOf(conflicts))
                .build();

        versionStore.storeDiff(diff);

        log.info("Diff complete: {} changes ({} nodes added, {} removed, {} modified; {} edges added, {} removed, "
                        + "{} modified), {} conflicts, similarity={}",
                statistics.getTotalChanges(),
                statistics.getNodesAdded(), statistics.getNodesRemoved(), statistics.getNodesModified(),
                statistics.getEdgesAdded(), statistics.getEdgesRemoved(), statistics.getEdgesModified(),
                conflicts.size(), String.format("%.3f", statistics.getSimilarity()));
        return diff;
    }

    /**
     * Compares two stored versions; the resulting diff is labelled with their ids.
     *
     * @throws VersionNotFoundException if either id is unknown
     */
    public GraphDiff compareVersions(String sourceVersionId, String targetVersionId, DiffOptions options) {
        GraphVersion source = requireVersion(sourceVersionId);
        GraphVersion target = requireVersion(targetVersionId);

        GraphDiff diff = compareGraphs(source.getGraph(), target.getGraph(), options)
                .withVersions(sourceVersionId, targetVersionId);
        versionStore.storeDiff(diff);
        return diff;
    }

    public GraphDiff compareVersions(String sourceVersionId, String targetVersionId) {
        return compareVersions(sourceVersionId, targetVersionId, defaultDiffOptions);
    }

    // ========================= PATCHES =========================

    public GraphPatch createPatch(GraphDiff diff) {
        return createPatch(diff, properties.getPatchCreatedBy());
    }

    public GraphPatch createPatch(GraphDiff diff, String createdBy) {
        return patchCompiler.compile(diff, createdBy);
    }

    public GraphSnapshot applyPatch(GraphSnapshot snapshot, GraphPatch patch) {
        return patchApplier.apply(snapshot, patch);
    }

    /**
     * @throws com.architecture.memory.graphdiff.exception.PatchIntegrityException if the checksum does not match
     */
    public void verifyPatch(GraphPatch patch) {
        patchApplier.verify(patch);
    }

    // ========================= VERSIONS =========================

    public GraphVersion storeVersion(GraphVersion version) {
        GraphVersion stored = version.getTimestamp() != null
                ? version
                : version.toBuilder().timestamp(Instant.now()).build();
        versionStore.storeVersion(stored);
        log.info("Stored version {} by {} ({} nodes, {} edges)", stored.getId(), stored.getAuthor(),
                stored.getGraph().getNodes().size(), stored.getGraph().getEdges().size());
        return stored;
    }

    public List<GraphVersion> getVersionHistory() {
        return versionStore.getVersionHistory();
    }

    public Optional<GraphVersion> getVersion(String versionId) {
        return versionStore.findVersion(versionId);
    }

    public Optional<GraphDiff> getDiff(String diffId) {
        return versionStore.findDiff(diffId);
    }

    private GraphVersion requireVersion(String versionId) {
        return versionStore.findVersion(versionId)
                .orElseThrow(() -> new VersionNotFoundException(versionId));
    }

    // ========================= PRESENTATION =========================

    /**
     * One highlight per change, in change order, for diff renderers.
     */
    public List<DiffHighlight> highlights(GraphDiff diff) {
        List<DiffHighlight> highlights = new ArrayList<>(diff.getChanges().size());
        for (Change change : diff.getChanges()) {
            highlights.add(DiffHighlight.builder()
                    .entityId(change.getEntityId())
                    .entityType(change.getEntity())
                    .changeType(change.getType())
                    .impact(change.getImpact())
                    .color(colorOf(change))
                    .description(describe(change))
                    .build());
        }
        return highlights;
    }

    /**
     * Changes of the diff matching the filter. A filter that throws on a change
     * is logged and counted, and that change is left out.
     */
    public List<Change> filterChanges(GraphDiff diff, ChangeFilter filter) {
        List<Change> result = new ArrayList<>();
        for (Change change : diff.getChanges()) {
            try {
                if (filter.test(change)) {
                    result.add(change);
                }
            } catch (RuntimeException e) {
                filterFailures.incrementAndGet();
                log.warn("Change filter {} failed on change {}, skipping: {}", filter, change.getId(), e.getMessage());
            }
        }
        return result;
    }

    public long getFilterFailureCount() {
        return filterFailures.get();
    }

    public DiffOptions defaultOptions() {
        return defaultDiffOptions;
    }

    private static String colorOf(Change change) {
        return switch (change.getType().getAction()) {
            case ADDED -> COLOR_ADDED;
            case REMOVED -> COLOR_REMOVED;
            case MODIFIED -> COLOR_MODIFIED;
        };
    }

    static String describe(Change change) {
        String kind = change.getEntity().name().toLowerCase();
        return switch (change.getType().getAction()) {
            case ADDED -> "Added " + kind + ": " + change.getEntityId();
            case REMOVED -> "Removed " + kind + ": " + change.getEntityId();
            case MODIFIED -> "Modified " + kind + ": " + change.getEntityId() + " ("
                    + (change.hasPath() ? String.join(".", change.getPath()) : "properties") + ")";
        };
    }
}
