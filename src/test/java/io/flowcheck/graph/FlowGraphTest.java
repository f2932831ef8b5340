package io.flowcheck.graph;

import io.flowcheck.model.FlowchartEdge;
import io.flowcheck.model.NodeType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowGraphTest {

    private FlowGraph.Builder builder;

    @BeforeEach
    void setUp() {
        builder = FlowGraph.builder();
        builder.addNode(FlowNode.of("n1", NodeType.START, "Start"));
        builder.addNode(FlowNode.of("n2", NodeType.DECISION, "x > 0?"));
        builder.addNode(FlowNode.of("n3", NodeType.PROCESS, "x = x - 1"));
        builder.addNode(FlowNode.of("n4", NodeType.END, "End"));
    }

    @Test
    void addNode_keepsFirstNodeForDuplicateId() {
        boolean added = builder.addNode(FlowNode.of("n2", NodeType.PROCESS, "duplicate"));

        FlowGraph graph = builder.build();

        assertThat(added).isFalse();
        assertThat(graph.nodeCount()).isEqualTo(4);
        assertThat(graph.typeOf("n2")).contains(NodeType.DECISION);
    }

    @Test
    void addEdge_rejectsUnknownEndpoint() {
        assertThatThrownBy(() -> builder.addEdge("n1", "missing"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void successors_areDistinctButDegreesCountParallelEdges() {
        FlowGraph graph = builder
                .addEdge("n1", "n2")
                .addEdge("n2", "n3")
                .addEdge("n2", "n3")
                .addEdge("n2", "n4")
                .build();

        assertThat(graph.successors("n2")).containsExactly("n3", "n4");
        assertThat(graph.outDegree("n2")).isEqualTo(3);
        assertThat(graph.inDegree("n3")).isEqualTo(2);
        assertThat(graph.predecessors("n3")).containsExactly("n2");
        assertThat(graph.edgeCount()).isEqualTo(4);
    }

    @Test
    void nodesOfType_preservesInputOrder() {
        builder.addNode(FlowNode.of("n5", NodeType.DECISION, "y?"));
        FlowGraph graph = builder.build();

        assertThat(graph.nodeIdsOfType(NodeType.DECISION)).containsExactly("n2", "n5");
        assertThat(graph.indexOf("n5")).isEqualTo(4);
        assertThat(graph.indexOf("unknown")).isEqualTo(-1);
    }

    @Test
    void unknownNodes_haveNoNeighbours() {
        FlowGraph graph = builder.build();

        assertThat(graph.getNode("nope")).isEmpty();
        assertThat(graph.successors("nope")).isEmpty();
        assertThat(graph.outDegree("nope")).isZero();
        assertThat(graph.isOfType("nope", NodeType.START)).isFalse();
    }

    @Test
    void droppedEdges_areKeptSeparately() {
        FlowGraph graph = builder
                .addDroppedEdge(FlowchartEdge.of("e9", "n1", "ghost"))
                .build();

        assertThat(graph.edgeCount()).isZero();
        assertThat(graph.droppedEdges()).extracting(FlowchartEdge::id).containsExactly("e9");
    }

    @Test
    void describe_usesValueOrFallback() {
        assertThat(FlowNode.of("n2", NodeType.DECISION, "x > 0?").describe("decision node"))
                .isEqualTo("'x > 0?' (ID: n2)");
        assertThat(FlowNode.of("n7", NodeType.DECISION, null).describe("decision node"))
                .isEqualTo("decision node (ID: n7)");
    }
}
