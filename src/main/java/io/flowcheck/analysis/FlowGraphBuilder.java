package io.flowcheck.analysis;

import io.flowcheck.graph.FlowEdge;
import io.flowcheck.graph.FlowGraph;
import io.flowcheck.graph.FlowNode;
import io.flowcheck.model.Flowchart;
import io.flowcheck.model.FlowchartEdge;
import io.flowcheck.model.FlowchartNode;
import io.flowcheck.model.InvalidFlowchartException;
import io.flowcheck.model.NodeType;
import io.flowcheck.model.SubroutineInfo;
import io.flowcheck.normalize.SubroutineInfoParser;
import io.flowcheck.normalize.TypeNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

/**
 * Builds the analysis graph from drawn nodes and edges.
 * <p>
 * Phase 1 normalizes every node type, parses subroutine signatures and adds every node,
 * connected or not. Phase 2 adds each edge whose endpoints both exist; any other edge is
 * dropped, logged and kept in {@link FlowGraph#droppedEdges()}.
 */
public class FlowGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(FlowGraphBuilder.class);

    private final SubroutineInfoParser subroutineParser;

    public FlowGraphBuilder() {
        this(new SubroutineInfoParser());
    }

    public FlowGraphBuilder(SubroutineInfoParser subroutineParser) {
        this.subroutineParser = subroutineParser;
    }

    /**
     * Builds the graph for a flowchart.
     */
    public FlowGraph build(Flowchart flowchart) {
        if (flowchart == null) {
            throw new InvalidFlowchartException("flowchart cannot be null");
        }
        return build(flowchart.nodes(), flowchart.edges());
    }

    /**
     * Builds the graph from node and edge collections.
     *
     * @throws InvalidFlowchartException if a collection is null or a node has no id
     */
    public FlowGraph build(Collection<FlowchartNode> nodes, Collection<FlowchartEdge> edges) {
        if (nodes == null) {
            throw new InvalidFlowchartException("nodes cannot be null");
        }
        if (edges == null) {
            throw new InvalidFlowchartException("edges cannot be null");
        }

        FlowGraph.Builder builder = FlowGraph.builder();

        // Phase 1: nodes
        for (FlowchartNode node : nodes) {
            if (node == null || node.id() == null || node.id().isEmpty()) {
                throw new InvalidFlowchartException("Every node must have an id");
            }
            if (!builder.addNode(toFlowNode(node))) {
                log.warn("Skipping duplicate node id {}", node.id());
            }
        }

        // Phase 2: edges
        for (FlowchartEdge edge : edges) {
            if (edge == null) {
                log.warn("Skipping null edge entry");
                continue;
            }
            if (isEmpty(edge.sourceId()) || isEmpty(edge.targetId())
                    || !builder.hasNode(edge.sourceId()) || !builder.hasNode(edge.targetId())) {
                log.warn("Skipping edge {} due to missing source/target node or id. Source: {}, Target: {}",
                        edge.id(), edge.sourceId(), edge.targetId());
                builder.addDroppedEdge(edge);
                continue;
            }
            builder.addEdge(new FlowEdge(edge.id(), edge.sourceId(), edge.targetId(), edge.value()));
        }

        FlowGraph graph = builder.build();
        log.debug("Built flowchart graph with {} nodes, {} edges ({} dropped)",
                graph.nodeCount(), graph.edgeCount(), graph.droppedEdges().size());
        return graph;
    }

    private FlowNode toFlowNode(FlowchartNode node) {
        NodeType type = TypeNormalizer.normalize(node.style(), node.value(), node.type());
        SubroutineInfo subroutine = type == NodeType.SUBROUTINE
                ? subroutineParser.parse(node.value())
                : null;
        return new FlowNode(node.id(), type, node.value(), node.color(), node.parentId(), subroutine);
    }

    private static boolean isEmpty(String id) {
        return id == null || id.isEmpty();
    }
}
