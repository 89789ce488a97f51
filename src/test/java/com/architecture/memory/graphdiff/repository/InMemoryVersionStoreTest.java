package com.architecture.memory.graphdiff.repository;

import com.architecture.memory.graphdiff.dto.diff.GraphDiff;
import com.architecture.memory.graphdiff.model.graph.GraphSnapshot;
import com.architecture.memory.graphdiff.model.graph.GraphVersion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryVersionStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private InMemoryVersionStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryVersionStore();
    }

    @Test
    void startsEmpty() {
        assertThat(store.versionCount()).isZero();
        assertThat(store.diffCount()).isZero();
        assertThat(store.getVersionHistory()).isEmpty();
        assertThat(store.findVersion("v1")).isEmpty();
        assertThat(store.findDiff(null)).isEmpty();
    }

    @Test
    void history_isNewestFirst() {
        store.storeVersion(version("v1", T0));
        store.storeVersion(version("v3", T0.plusSeconds(120)));
        store.storeVersion(version("v2", T0.plusSeconds(60)));

        assertThat(store.getVersionHistory()).extracting(GraphVersion::getId)
                .containsExactly("v3", "v2", "v1");
    }

    @Test
    void storingSameId_replacesVersion() {
        store.storeVersion(version("v1", T0));
        store.storeVersion(version("v1", T0.plusSeconds(1)).toBuilder().message("amended").build());

        assertThat(store.versionCount()).isEqualTo(1);
        assertThat(store.findVersion("v1")).get()
                .extracting(GraphVersion::getMessage)
                .isEqualTo("amended");
    }

    @Test
    void diffsAreKeptById() {
        GraphDiff diff = GraphDiff.builder().id("diff_1").changes(List.of()).build();

        store.storeDiff(diff);

        assertThat(store.findDiff("diff_1")).containsSame(diff);
        assertThat(store.diffCount()).isEqualTo(1);
    }

    @Test
    void entriesWithoutId_areRejected() {
        assertThatThrownBy(() -> store.storeVersion(version(null, T0)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.storeDiff(GraphDiff.builder().id(" ").build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void concurrentWrites_areAllKept() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            IntStream.range(0, 200).forEach(i ->
                    executor.submit(() -> store.storeVersion(version("v" + i, T0.plusSeconds(i)))));
        } finally {
            executor.shutdown();
        }
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(store.versionCount()).isEqualTo(200);
        assertThat(store.getVersionHistory().get(0).getId()).isEqualTo("v199");
    }

    private static GraphVersion version(String id, Instant timestamp) {
        return GraphVersion.builder()
                .id(id)
                .timestamp(timestamp)
                .author("tester")
                .message("snapshot " + id)
                .graph(GraphSnapshot.empty())
                .build();
    }
}
