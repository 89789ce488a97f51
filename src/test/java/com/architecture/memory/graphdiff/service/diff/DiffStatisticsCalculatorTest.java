package com.architecture.memory.graphdiff.service.diff;

import com.architecture.memory.graphdiff.config.GraphDiffProperties;
import com.architecture.memory.graphdiff.dto.diff.Change;
import com.architecture.memory.graphdiff.dto.diff.DiffStatistics;
import com.architecture.memory.graphdiff.model.graph.GraphEdge;
import com.architecture.memory.graphdiff.model.graph.GraphNode;
import com.architecture.memory.graphdiff.model.graph.GraphSnapshot;
import com.architecture.memory.graphdiff.service.DiffIdGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.RepetitionInfo;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static com.architecture.memory.graphdiff.GraphFixtures.data;
import static com.architecture.memory.graphdiff.GraphFixtures.edge;
import static com.architecture.memory.graphdiff.GraphFixtures.node;
import static com.architecture.memory.graphdiff.GraphFixtures.snapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DiffStatisticsCalculatorTest {

    private static final String[] TYPES = {"component", "function", "class", "service"};

    private DiffStatisticsCalculator calculator;
    private GraphComparator comparator;

    @BeforeEach
    void setUp() {
        calculator = new DiffStatisticsCalculator();
        comparator = new GraphComparator(new DeepObjectDiffer(new GraphDiffProperties()), new ChangeClassifier(),
                new DiffIdGenerator());
    }

    @Test
    void noChanges_isFullySimilar() {
        GraphSnapshot graph = snapshot(List.of(node("a", "s"), node("b", "s")), List.of(edge("e1", "a", "b")));

        DiffStatistics statistics = calculator.calculate(List.of(), graph, graph);

        assertThat(statistics.getTotalChanges()).isZero();
        assertThat(statistics.getSimilarity()).isEqualTo(1.0);
        assertThat(statistics.getComplexity()).isZero();
    }

    @Test
    void emptyGraphs_areFullySimilar() {
        DiffStatistics statistics = calculator.calculate(List.of(), GraphSnapshot.empty(), GraphSnapshot.empty());

        assertThat(statistics.getSimilarity()).isEqualTo(1.0);
        assertThat(statistics.getComplexity()).isZero();
    }

    @Test
    void countsChangesPerTypeAndDistinctEntities() {
        GraphSnapshot source = snapshot(
                List.of(node("a", "s", data("x", 1, "y", 1)), node("b", "s"), node("c", "s")),
                List.of(edge("e1", "a", "b")));
        GraphSnapshot target = snapshot(
                List.of(node("a", "s", data("x", 2, "y", 2)), node("b", "s"), node("d", "s")),
                List.of(edge("e1", "a", "b"), edge("e2", "a", "d")));

        List<Change> changes = comparator.compare(source, target, DiffOptions.defaults());
        DiffStatistics statistics = calculator.calculate(changes, source, target);

        assertThat(statistics.getNodesAdded()).isEqualTo(1);
        assertThat(statistics.getNodesRemoved()).isEqualTo(1);
        assertThat(statistics.getNodesModified()).isEqualTo(2);
        assertThat(statistics.getEdgesAdded()).isEqualTo(1);
        assertThat(statistics.getEdgesRemoved()).isZero();
        assertThat(statistics.getEdgesModified()).isZero();
        assertThat(statistics.getTotalChanges()).isEqualTo(5);

        // 4 distinct entities (a, c, d, e2) out of max(4, 5)
        assertThat(statistics.getSimilarity()).isCloseTo(1.0 - 4.0 / 5.0, within(1e-9));
        // node added, node removed, edge added are structural
        assertThat(statistics.getComplexity()).isCloseTo(3.0 / 5.0, within(1e-9));
    }

    @Test
    void manyChangesOnSmallGraph_areClampedToOne() {
        GraphSnapshot source = snapshot(List.of(node("a", "s", data("p", 1, "q", 1, "r", 1))), List.of());
        GraphSnapshot target = snapshot(List.of(node("a", "t", data("p", "1", "q", "1", "r", "1"))), List.of());

        List<Change> changes = comparator.compare(source, target, DiffOptions.defaults());
        DiffStatistics statistics = calculator.calculate(changes, source, target);

        assertThat(changes).hasSize(4);
        assertThat(statistics.getComplexity()).isEqualTo(1.0);
        assertThat(statistics.getSimilarity()).isZero();
    }

    @RepeatedTest(25)
    void ratiosStayWithinBounds_forGeneratedGraphs(RepetitionInfo repetition) {
        Random random = new Random(repetition.getCurrentRepetition());
        GraphSnapshot source = randomGraph(random);
        GraphSnapshot target = randomGraph(random);

        List<Change> changes = comparator.compare(source, target,
                DiffOptions.builder().semanticDiff(true).build());
        DiffStatistics statistics = calculator.calculate(changes, source, target);

        assertThat(statistics.getSimilarity()).isBetween(0.0, 1.0);
        assertThat(statistics.getComplexity()).isBetween(0.0, 1.0);
        assertThat(statistics.getTotalChanges()).isEqualTo(changes.size());
    }

    private static GraphSnapshot randomGraph(Random random) {
        int nodeCount = random.nextInt(8);
        List<GraphNode> nodes = new ArrayList<>();
        for (int i = 0; i < nodeCount; i++) {
            nodes.add(node("n" + random.nextInt(10), TYPES[random.nextInt(TYPES.length)],
                    data("weight", random.nextInt(3), "label", "l" + random.nextInt(2))));
        }

        int edgeCount = random.nextInt(8);
        List<GraphEdge> edges = new ArrayList<>();
        for (int i = 0; i < edgeCount; i++) {
            edges.add(edge("e" + random.nextInt(10), "n" + random.nextInt(10), "n" + random.nextInt(10),
                    random.nextBoolean() ? "sync" : "async"));
        }
        return snapshot(nodes, edges);
    }
}
