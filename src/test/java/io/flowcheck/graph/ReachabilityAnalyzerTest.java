package io.flowcheck.graph;

import io.flowcheck.model.NodeType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReachabilityAnalyzerTest {

    private static FlowGraph graph(String... edges) {
        FlowGraph.Builder builder = FlowGraph.builder();
        for (String id : List.of("a", "b", "c", "d", "e")) {
            builder.addNode(FlowNode.of(id, NodeType.PROCESS, id));
        }
        for (String edge : edges) {
            String[] parts = edge.split("->");
            builder.addEdge(parts[0], parts[1]);
        }
        return builder.build();
    }

    @Test
    void descendants_excludeNodeOutsideCycle() {
        ReachabilityAnalyzer analyzer = new ReachabilityAnalyzer(graph("a->b", "b->c"));

        assertThat(analyzer.descendants("a")).containsExactlyInAnyOrder("b", "c");
        assertThat(analyzer.descendants("c")).isEmpty();
    }

    @Test
    void descendants_excludeNodeOnCycle() {
        ReachabilityAnalyzer analyzer = new ReachabilityAnalyzer(graph("a->b", "b->c", "c->b"));

        assertThat(analyzer.descendants("b")).containsExactly("c");
        assertThat(analyzer.ancestors("b")).containsExactlyInAnyOrder("a", "c");
        assertThat(analyzer.hasPath("b", "b")).isFalse();
    }

    @Test
    void descendantsAndAncestors_ignoreSelfLoop() {
        ReachabilityAnalyzer analyzer = new ReachabilityAnalyzer(graph("a->a"));

        assertThat(analyzer.descendants("a")).isEmpty();
        assertThat(analyzer.ancestors("a")).isEmpty();
    }

    @Test
    void ancestors_followEdgesBackwards() {
        ReachabilityAnalyzer analyzer = new ReachabilityAnalyzer(graph("a->b", "b->c", "d->c"));

        assertThat(analyzer.ancestors("c")).containsExactlyInAnyOrder("a", "b", "d");
        assertThat(analyzer.ancestors("a")).isEmpty();
    }

    @Test
    void reachableFrom_includesRoots() {
        ReachabilityAnalyzer analyzer = new ReachabilityAnalyzer(graph("a->b", "d->e"));

        assertThat(analyzer.reachableFrom(List.of("a", "unknown"))).containsExactly("a", "b");
        assertThat(analyzer.hasPath("a", "b")).isTrue();
        assertThat(analyzer.hasPath("a", "e")).isFalse();
    }
}
