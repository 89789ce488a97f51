package com.architecture.memory.graphdiff.service.patch;

import com.architecture.memory.graphdiff.config.GraphDiffProperties;
import com.architecture.memory.graphdiff.dto.diff.Change;
import com.architecture.memory.graphdiff.dto.diff.ChangeType;
import com.architecture.memory.graphdiff.dto.diff.GraphDiff;
import com.architecture.memory.graphdiff.dto.patch.GraphPatch;
import com.architecture.memory.graphdiff.dto.patch.PatchOp;
import com.architecture.memory.graphdiff.dto.patch.PatchOperation;
import com.architecture.memory.graphdiff.model.graph.GraphSnapshot;
import com.architecture.memory.graphdiff.service.DiffIdGenerator;
import com.architecture.memory.graphdiff.service.diff.ChangeClassifier;
import com.architecture.memory.graphdiff.service.diff.DeepObjectDiffer;
import com.architecture.memory.graphdiff.service.diff.DiffOptions;
import com.architecture.memory.graphdiff.service.diff.GraphComparator;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.architecture.memory.graphdiff.GraphFixtures.data;
import static com.architecture.memory.graphdiff.GraphFixtures.edge;
import static com.architecture.memory.graphdiff.GraphFixtures.node;
import static com.architecture.memory.graphdiff.GraphFixtures.snapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class PatchCompilerTest {

    private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();

    private PatchChecksumCalculator checksumCalculator;
    private PatchCompiler compiler;
    private GraphComparator comparator;

    @BeforeEach
    void setUp() {
        DiffIdGenerator idGenerator = new DiffIdGenerator();
        checksumCalculator = new PatchChecksumCalculator();
        compiler = new PatchCompiler(checksumCalculator, idGenerator);
        comparator = new GraphComparator(new DeepObjectDiffer(new GraphDiffProperties()), new ChangeClassifier(),
                idGenerator);
    }

    @Test
    void mapsEachChangeToAnOperation_inChangeOrder() {
        GraphSnapshot source = snapshot(
                List.of(node("a", "service", data("port", 80, "legacy", true)), node("gone", "class")),
                List.of(edge("e1", "a", "gone")));
        GraphSnapshot target = snapshot(
                List.of(node("a", "component", data("port", 8080)), node("fresh", "function")),
                List.of(edge("e2", "a", "fresh")));

        GraphPatch patch = compiler.compile(diff(source, target), "alice");

        assertThat(patch.getOperations())
                .extracting(PatchOperation::getOp, PatchOperation::getPath)
                .containsExactly(
                        tuple(PatchOp.ADD, "/nodes/fresh"),
                        tuple(PatchOp.REMOVE, "/nodes/gone"),
                        tuple(PatchOp.REPLACE, "/nodes/a/type"),
                        tuple(PatchOp.REPLACE, "/nodes/a/data/port"),
                        tuple(PatchOp.REMOVE, "/nodes/a/data/legacy"),
                        tuple(PatchOp.ADD, "/edges/e2"),
                        tuple(PatchOp.REMOVE, "/edges/e1"));

        assertThat(patch.getOperations().get(0).getValue()).isEqualTo(node("fresh", "function"));
        assertThat(patch.getOperations().get(2).getValue()).isEqualTo("component");
        assertThat(patch.getOperations().get(3).getValue()).isEqualTo(8080);
        assertThat(patch.getOperations().get(4).getValue()).isNull();
    }

    @Test
    void fillsPatchMetadata() {
        GraphDiff diff = diff(GraphSnapshot.empty(), snapshot(List.of(node("a", "s")), List.of()))
                .withVersions("v1", "v2");

        GraphPatch patch = compiler.compile(diff, "alice");

        assertThat(patch.getId()).startsWith("patch_");
        assertThat(patch.getSourceVersion()).isEqualTo("v1");
        assertThat(patch.getTargetVersion()).isEqualTo("v2");
        assertThat(patch.getMetadata().getCreatedBy()).isEqualTo("alice");
        assertThat(patch.getMetadata().getCreatedAt()).isNotNull();
        assertThat(patch.getMetadata().getDescription()).isEqualTo("Patch from v1 to v2");
        assertThat(patch.getMetadata().getSkippedChanges()).isEmpty();
    }

    @Test
    void modificationWithoutPath_isRecordedAsSkipped() {
        Change pathless = Change.builder()
                .id("change_diagnostic")
                .type(ChangeType.NODE_MODIFIED)
                .entityId("a")
                .build();
        GraphDiff diff = GraphDiff.builder()
                .id("diff_1")
                .sourceVersion("source")
                .targetVersion("target")
                .changes(List.of(pathless))
                .conflicts(List.of())
                .build();

        GraphPatch patch = compiler.compile(diff, "alice");

        assertThat(patch.getOperations()).isEmpty();
        assertThat(patch.getMetadata().getSkippedChanges()).containsExactly("change_diagnostic");
    }

    @Test
    void compilingTheSameDiffTwice_givesTheSameChecksum() {
        GraphDiff diff = diff(
                snapshot(List.of(node("a", "s", data("v", 1))), List.of()),
                snapshot(List.of(node("a", "s", data("v", 2))), List.of(edge("e1", "a", "a"))));

        GraphPatch first = compiler.compile(diff, "alice");
        GraphPatch second = compiler.compile(diff, "bob");

        assertThat(first.getId()).isNotEqualTo(second.getId());
        assertThat(first.getChecksum()).isEqualTo(second.getChecksum()).hasSize(64);
    }

    @Test
    void reorderingChanges_changesTheChecksum() {
        GraphDiff diff = diff(
                snapshot(List.of(node("a", "s")), List.of()),
                snapshot(List.of(node("b", "s")), List.of()));
        List<Change> reversed = new ArrayList<>(diff.getChanges());
        Collections.reverse(reversed);

        GraphPatch original = compiler.compile(diff, "alice");
        GraphPatch reordered = compiler.compile(diff.toBuilder().changes(reversed).build(), "alice");

        assertThat(reordered.getChecksum()).isNotEqualTo(original.getChecksum());
    }

    @Test
    void checksumSurvivesJsonRoundTrip() throws Exception {
        GraphDiff diff = diff(
                snapshot(List.of(node("a", "s", data("ratio", 0.25, "tags", List.of("x")))), List.of()),
                snapshot(List.of(node("a", "s", data("ratio", 0.5, "tags", List.of("x", "y")))),
                        List.of(edge("e1", "a", "a", "calls", data("weight", 3)))));
        GraphPatch patch = compiler.compile(diff, "alice");

        String json = objectMapper.writeValueAsString(patch.getOperations());
        List<PatchOperation> readBack = objectMapper.readValue(json, new TypeReference<>() {
        });

        assertThat(readBack.get(readBack.size() - 1).getValue()).isInstanceOf(Map.class);
        assertThat(checksumCalculator.calculate(readBack)).isEqualTo(patch.getChecksum());
        assertThat(checksumCalculator.matches(readBack, patch.getChecksum())).isTrue();
    }

    @Test
    void editingSnapshotsAfterCompile_leavesPatchIntact() {
        Map<String, Object> limits = data("cpu", 1);
        Map<String, Object> freshData = data("port", 80);
        GraphSnapshot source = snapshot(List.of(node("a", "s", data("v", 1))), List.of());
        GraphSnapshot target = snapshot(
                List.of(node("a", "s", data("v", 1, "limits", limits)), node("fresh", "s", freshData)),
                List.of());

        GraphPatch patch = compiler.compile(diff(source, target), "alice");
        String checksum = patch.getChecksum();

        limits.put("cpu", 8);
        freshData.put("port", 9090);

        assertThat(patch.getOperations())
                .extracting(PatchOperation::getPath, PatchOperation::getValue)
                .containsExactly(
                        tuple("/nodes/fresh", node("fresh", "s", data("port", 80))),
                        tuple("/nodes/a/data/limits", data("cpu", 1)));
        assertThat(checksumCalculator.matches(patch.getOperations(), checksum)).isTrue();
    }

    @Test
    void canonicalJson_sortsKeysAndUsesLowerCaseOps() {
        PatchOperation operation = PatchOperation.builder()
                .op(PatchOp.REPLACE)
                .path("/nodes/a/data")
                .value(data("z", 1, "a", 2))
                .build();

        assertThat(checksumCalculator.canonicalJson(List.of(operation)))
                .isEqualTo("[{\"op\":\"replace\",\"path\":\"/nodes/a/data\",\"value\":{\"a\":2,\"z\":1}}]");
    }

    private GraphDiff diff(GraphSnapshot source, GraphSnapshot target) {
        return GraphDiff.builder()
                .id("diff_test")
                .sourceVersion("source")
                .targetVersion("target")
                .changes(comparator.compare(source, target, DiffOptions.defaults()))
                .conflicts(List.of())
                .build();
    }
}
