package io.flowcheck.rules;

import io.flowcheck.graph.FlowGraph;
import io.flowcheck.graph.FlowNode;
import io.flowcheck.graph.ReachabilityAnalyzer;
import io.flowcheck.model.AnalysisResult;
import io.flowcheck.model.Flowchart;
import io.flowcheck.model.NodeType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Flags nodes that no start node can reach.
 * Does nothing when there is no start node; that case belongs to {@link SingleStartMultipleEndRule}.
 */
public class UnreachableCodeRule implements AnalysisRule {

    public static final String UNREACHABLE_CODE = "UNREACHABLE_CODE";

    @Override
    public String id() {
        return "unreachable-code";
    }

    @Override
    public String description() {
        return "Nodes not reachable from any start node";
    }

    @Override
    public List<AnalysisResult> apply(Flowchart flowchart, FlowGraph graph) {
        if (graph.isEmpty()) {
            return List.of();
        }
        List<String> startIds = graph.nodeIdsOfType(NodeType.START);
        if (startIds.isEmpty()) {
            return List.of();
        }

        Set<String> reachable = new ReachabilityAnalyzer(graph).reachableFrom(startIds);

        List<AnalysisResult> results = new ArrayList<>();
        for (FlowNode node : graph.allNodes()) {
            if (!reachable.contains(node.id())) {
                results.add(AnalysisResult.warning(UNREACHABLE_CODE,
                        "The " + node.describe("element") + " is unreachable from any start node.",
                        List.of(node.id())));
            }
        }
        return results;
    }
}
