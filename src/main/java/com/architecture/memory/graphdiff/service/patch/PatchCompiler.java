package com.architecture.memory.graphdiff.service.patch;

import com.architecture.memory.graphdiff.dto.diff.Change;
import com.architecture.memory.graphdiff.dto.diff.GraphDiff;
import com.architecture.memory.graphdiff.dto.patch.GraphPatch;
import com.architecture.memory.graphdiff.dto.patch.PatchMetadata;
import com.architecture.memory.graphdiff.dto.patch.PatchOp;
import com.architecture.memory.graphdiff.dto.patch.PatchOperation;
import com.architecture.memory.graphdiff.model.graph.GraphEdge;
import com.architecture.memory.graphdiff.model.graph.GraphEntity;
import com.architecture.memory.graphdiff.model.graph.GraphNode;
import com.architecture.memory.graphdiff.service.DiffIdGenerator;
import com.architecture.memory.graphdiff.service.diff.JsonValues;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns a diff into an ordered patch.
 *
 * Mapping:
 * - *_ADDED    -> add     /{kind}/{id}          value = entity after
 * - *_REMOVED  -> remove  /{kind}/{id}
 * - *_MODIFIED -> replace /{kind}/{id}/{path}   value = new value
 *                 remove  /{kind}/{id}/{path}   when the property was removed
 *
 * Operations keep the order of the diff's changes. Modifications without a path
 * cannot be expressed and are listed in the patch metadata as skipped.
 * Values are deep copies, so later edits to the compared snapshots leave the
 * patch and its checksum intact.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PatchCompiler {

    private final PatchChecksumCalculator checksumCalculator;
    private final DiffIdGenerator idGenerator;

    public GraphPatch compile(GraphDiff diff, String createdBy) {
        List<PatchOperation> operations = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        for (Change change : diff.getChanges()) {
            Optional<PatchOperation> operation = toOperation(change);
            if (operation.isPresent()) {
                operations.add(operation.get());
            } else {
                skipped.add(change.getId());
                log.debug("Change {} on {} has no patchable path, skipped", change.getId(), change.getEntityId());
            }
        }

        GraphPatch patch = GraphPatch.builder()
                .id(idGenerator.generatePatchId())
                .sourceVersion(diff.getSourceVersion())
                .targetVersion(diff.getTargetVersion())
                .operations(List.copyOf(operations))
                .checksum(checksumCalculator.calculate(operations))
                .metadata(PatchMetadata.builder()
                        .createdAt(Instant.now())
                        .createdBy(createdBy)
                        .description("Patch from " + diff.getSourceVersion() + " to " + diff.getTargetVersion())
                        .skippedChanges(skipped)
                        .build())
                .build();

        log.info("Compiled patch {} from diff {}: {} operations, {} skipped",
                patch.getId(), diff.getId(), operations.size(), skipped.size());
        return patch;
    }

    Optional<PatchOperation> toOperation(Change change) {
        String entityPath = PatchPath.of(change.getEntity(), change.getEntityId(), List.of()).format();

        return switch (change.getType()) {
            case NODE_ADDED, EDGE_ADDED -> Optional.of(PatchOperation.builder()
                    .op(PatchOp.ADD)
                    .path(entityPath)
                    .value(detach(change.getAfter()))
                    .build());
            case NODE_REMOVED, EDGE_REMOVED -> Optional.of(PatchOperation.builder()
                    .op(PatchOp.REMOVE)
                    .path(entityPath)
                    .build());
            case NODE_MODIFIED, EDGE_MODIFIED -> modification(change);
        };
    }

    private Optional<PatchOperation> modification(Change change) {
        if (!change.hasPath()) {
            return Optional.empty();
        }

        String propertyPath = PatchPath.of(change.getEntity(), change.getEntityId(), change.getPath()).format();

        if (!change.hasNewValue()) {
            return Optional.of(PatchOperation.builder()
                    .op(PatchOp.REMOVE)
                    .path(propertyPath)
                    .build());
        }

        return Optional.of(PatchOperation.builder()
                .op(PatchOp.REPLACE)
                .path(propertyPath)
                .value(JsonValues.deepCopy(change.getNewValue()))
                .build());
    }

    private static GraphEntity detach(GraphEntity entity) {
        if (entity == null || entity.getData() == null) {
            return entity;
        }
        if (entity instanceof GraphNode node) {
            return node.toBuilder().data(JsonValues.deepCopyMap(node.getData())).build();
        }
        GraphEdge edge = (GraphEdge) entity;
        return edge.toBuilder().data(JsonValues.deepCopyMap(edge.getData())).build();
    }
}
