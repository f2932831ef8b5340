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
 * Flags input that never reaches any logic and output that no logic produces.
 * <p>
 * Only process and decision nodes count as logic. Isolated I/O nodes are left to
 * {@link UnconnectedSymbolsRule}.
 */
public class OrphanedIoRule implements AnalysisRule {

    public static final String ORPHAN_INPUT = "ORPHAN_INPUT";
    public static final String ORPHAN_OUTPUT = "ORPHAN_OUTPUT";

    @Override
    public String id() {
        return "orphaned-io";
    }

    @Override
    public String description() {
        return "Input and output symbols not connected to any process or decision";
    }

    @Override
    public List<AnalysisResult> apply(Flowchart flowchart, FlowGraph graph) {
        ReachabilityAnalyzer reachability = new ReachabilityAnalyzer(graph);
        List<AnalysisResult> results = new ArrayList<>();

        for (FlowNode input : graph.nodesOfType(NodeType.INPUT)) {
            Set<String> descendants = reachability.descendants(input.id());
            if (!descendants.isEmpty() && !containsLogic(graph, descendants)) {
                results.add(AnalysisResult.warning(ORPHAN_INPUT,
                        "Input from " + input.describe("I/O node") + " is never used in a process or decision.",
                        List.of(input.id())));
            }
        }

        for (FlowNode output : graph.nodesOfType(NodeType.OUTPUT)) {
            Set<String> ancestors = reachability.ancestors(output.id());
            if (!ancestors.isEmpty() && !containsLogic(graph, ancestors)) {
                results.add(AnalysisResult.warning(ORPHAN_OUTPUT,
                        "Output to " + output.describe("I/O node")
                                + " does not seem to originate from any process or decision.",
                        List.of(output.id())));
            }
        }

        return results;
    }

    private static boolean containsLogic(FlowGraph graph, Set<String> nodeIds) {
        return nodeIds.stream().anyMatch(id ->
                graph.isOfType(id, NodeType.PROCESS) || graph.isOfType(id, NodeType.DECISION));
    }
}
