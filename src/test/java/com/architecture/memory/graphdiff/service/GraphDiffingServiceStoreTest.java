package com.architecture.memory.graphdiff.service;

import com.architecture.memory.graphdiff.config.GraphDiffConfig;
import com.architecture.memory.graphdiff.config.GraphDiffProperties;
import com.architecture.memory.graphdiff.dto.diff.GraphDiff;
import com.architecture.memory.graphdiff.exception.VersionNotFoundException;
import com.architecture.memory.graphdiff.model.graph.GraphSnapshot;
import com.architecture.memory.graphdiff.model.graph.GraphVersion;
import com.architecture.memory.graphdiff.repository.VersionStore;
import com.architecture.memory.graphdiff.service.diff.ChangeClassifier;
import com.architecture.memory.graphdiff.service.diff.ConflictDetector;
import com.architecture.memory.graphdiff.service.diff.DeepObjectDiffer;
import com.architecture.memory.graphdiff.service.diff.DiffStatisticsCalculator;
import com.architecture.memory.graphdiff.service.diff.GraphComparator;
import com.architecture.memory.graphdiff.service.diff.TypeTransitionPolicy;
import com.architecture.memory.graphdiff.service.patch.PatchApplier;
import com.architecture.memory.graphdiff.service.patch.PatchChecksumCalculator;
import com.architecture.memory.graphdiff.service.patch.PatchCompiler;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.architecture.memory.graphdiff.GraphFixtures.node;
import static com.architecture.memory.graphdiff.GraphFixtures.snapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GraphDiffingServiceStoreTest {

    @Mock
    private VersionStore versionStore;

    private GraphDiffingService service;

    @BeforeEach
    void setUp() {
        GraphDiffProperties properties = new GraphDiffProperties();
        DiffIdGenerator idGenerator = new DiffIdGenerator();
        ChangeClassifier classifier = new ChangeClassifier();
        PatchChecksumCalculator checksumCalculator = new PatchChecksumCalculator();

        service = new GraphDiffingService(
                new GraphComparator(new DeepObjectDiffer(properties), classifier, idGenerator),
                classifier,
                new ConflictDetector(new TypeTransitionPolicy(properties), idGenerator),
                new DiffStatisticsCalculator(),
                new PatchCompiler(checksumCalculator, idGenerator),
                new PatchApplier(checksumCalculator, JsonMapper.builder().findAndAddModules().build()),
                versionStore,
                idGenerator,
                properties,
                new GraphDiffConfig().defaultDiffOptions(properties));
    }

    @Test
    void compareGraphs_registersDiffInStore() {
        GraphDiff diff = service.compareGraphs(
                snapshot(List.of(node("a", "service")), List.of()),
                snapshot(List.of(node("a", "service"), node("b", "repository")), List.of()));

        ArgumentCaptor<GraphDiff> captor = ArgumentCaptor.forClass(GraphDiff.class);
        verify(versionStore).storeDiff(captor.capture());
        assertThat(captor.getValue()).isSameAs(diff);
        assertThat(captor.getValue().getChanges()).hasSize(1);
    }

    @Test
    void compareVersions_storesDiffLabelledWithVersionIds() {
        when(versionStore.findVersion("v1")).thenReturn(Optional.of(version("v1", GraphSnapshot.empty())));
        when(versionStore.findVersion("v2"))
                .thenReturn(Optional.of(version("v2", snapshot(List.of(node("a", "service")), List.of()))));

        GraphDiff diff = service.compareVersions("v1", "v2");

        ArgumentCaptor<GraphDiff> captor = ArgumentCaptor.forClass(GraphDiff.class);
        verify(versionStore, times(2)).storeDiff(captor.capture());
        GraphDiff stored = captor.getAllValues().get(1);
        assertThat(stored).isSameAs(diff);
        assertThat(stored.getSourceVersion()).isEqualTo("v1");
        assertThat(stored.getTargetVersion()).isEqualTo("v2");
        assertThat(stored.getId()).isEqualTo(captor.getAllValues().get(0).getId());
    }

    @Test
    void compareVersions_whenSourceMissing_doesNotStoreAnything() {
        when(versionStore.findVersion("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.compareVersions("missing", "v2"))
                .isInstanceOf(VersionNotFoundException.class);

        verify(versionStore, never()).storeDiff(any());
    }

    @Test
    void storeVersion_whenTimestampMissing_stampsBeforeStoring() {
        GraphVersion unstamped = version("v1", GraphSnapshot.empty()).toBuilder().timestamp(null).build();

        GraphVersion stored = service.storeVersion(unstamped);

        ArgumentCaptor<GraphVersion> captor = ArgumentCaptor.forClass(GraphVersion.class);
        verify(versionStore).storeVersion(captor.capture());
        assertThat(captor.getValue().getTimestamp()).isNotNull();
        assertThat(captor.getValue()).isSameAs(stored);
    }

    private static GraphVersion version(String id, GraphSnapshot graph) {
        return GraphVersion.builder()
                .id(id)
                .timestamp(Instant.parse("2024-01-01T00:00:00Z"))
                .author("tester")
                .message("snapshot " + id)
                .graph(graph)
                .build();
    }
}
