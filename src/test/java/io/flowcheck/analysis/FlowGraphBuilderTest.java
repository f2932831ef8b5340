package io.flowcheck.analysis;

import io.flowcheck.Flowcharts;
import io.flowcheck.graph.FlowGraph;
import io.flowcheck.graph.FlowNode;
import io.flowcheck.model.Flowchart;
import io.flowcheck.model.FlowchartEdge;
import io.flowcheck.model.FlowchartNode;
import io.flowcheck.model.InvalidFlowchartException;
import io.flowcheck.model.NodeType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowGraphBuilderTest {

    private FlowGraphBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new FlowGraphBuilder();
    }

    @Test
    void build_normalizesTypesFromShapes() {
        Flowchart flowchart = Flowcharts.builder()
                .styled("n1", "ellipse;whiteSpace=wrap;", "Start")
                .styled("n2", "shape=parallelogram;", "Read n")
                .styled("n3", "rhombus;", "n > 0?")
                .styled("n4", "ellipse;", "End")
                .path("n1", "n2", "n3", "n4")
                .build();

        FlowGraph graph = builder.build(flowchart);

        assertThat(graph.allNodes()).extracting(FlowNode::type)
                .containsExactly(NodeType.START, NodeType.INPUT, NodeType.DECISION, NodeType.END);
        assertThat(graph.edgeCount()).isEqualTo(3);
    }

    @Test
    void build_attachesSubroutineInfoOnlyToSubroutines() {
        Flowchart flowchart = Flowcharts.builder()
                .styled("n1", "rounded=1;", "function area(w, h)")
                .styled("n2", "rounded=1;", "x = 1")
                .build();

        FlowGraph graph = builder.build(flowchart);

        FlowNode subroutine = graph.getNode("n1").orElseThrow();
        assertThat(subroutine.type()).isEqualTo(NodeType.SUBROUTINE);
        assertThat(subroutine.subroutineInfo()).hasValueSatisfying(info -> {
            assertThat(info.functionName()).isEqualTo("area");
            assertThat(info.parameters()).containsExactly("w", "h");
        });
        assertThat(graph.getNode("n2").orElseThrow().subroutineInfo()).isEmpty();
    }

    @Test
    void build_keepsIsolatedNodes() {
        FlowGraph graph = Flowcharts.builder()
                .node("n1", "start")
                .node("n2", "process")
                .graph();

        assertThat(graph.nodeIds()).containsExactly("n1", "n2");
        assertThat(graph.edgeCount()).isZero();
    }

    @Test
    void build_dropsEdgesWithMissingEndpoints() {
        List<FlowchartEdge> edges = new ArrayList<>();
        edges.add(FlowchartEdge.of("e1", "n1", "n2"));
        edges.add(FlowchartEdge.of("e2", "n2", "ghost"));
        edges.add(FlowchartEdge.of("e3", null, "n2"));
        edges.add(FlowchartEdge.of("e4", "n1", ""));
        Flowchart flowchart = Flowchart.of(
                List.of(FlowchartNode.of("n1", "Start", null, "start"), FlowchartNode.of("n2", "End", null, "end")),
                edges);

        FlowGraph graph = builder.build(flowchart);

        assertThat(graph.edgeCount()).isEqualTo(1);
        assertThat(graph.droppedEdges()).extracting(FlowchartEdge::id).containsExactly("e2", "e3", "e4");
    }

    @Test
    void build_skipsDuplicateNodeIds() {
        FlowGraph graph = Flowcharts.builder()
                .node("n1", "start", "Start")
                .node("n1", "end", "End")
                .graph();

        assertThat(graph.nodeCount()).isEqualTo(1);
        assertThat(graph.typeOf("n1")).contains(NodeType.START);
    }

    @Test
    void build_rejectsNullCollections() {
        assertThatThrownBy(() -> builder.build(null, List.of()))
                .isInstanceOf(InvalidFlowchartException.class);
        assertThatThrownBy(() -> builder.build(List.of(), null))
                .isInstanceOf(InvalidFlowchartException.class);
    }

    @Test
    void build_rejectsNodeWithoutId() {
        Flowchart flowchart = Flowchart.of(List.of(FlowchartNode.of(null, "Start", null, "start")), List.of());

        assertThatThrownBy(() -> builder.build(flowchart))
                .isInstanceOf(InvalidFlowchartException.class)
                .hasMessageContaining("id");
    }
}
