package io.flowcheck.rules;

import io.flowcheck.AnalysisConfig;
import io.flowcheck.graph.FlowGraph;
import io.flowcheck.graph.FlowNode;
import io.flowcheck.graph.PathFinder;
import io.flowcheck.graph.ReachabilityAnalyzer;
import io.flowcheck.model.AnalysisResult;
import io.flowcheck.model.Flowchart;
import io.flowcheck.model.NodeType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reports decisions nested too deeply.
 * <p>
 * The nesting depth of a decision is the largest number of decisions preceding it on any
 * simple path from a start node. Path enumeration is exponential in the number of branches,
 * so {@code maxPaths} can cap it per start/decision pair.
 */
public class DecisionNestingDepthRule implements AnalysisRule {

    public static final String DEEP_NESTING = "DEEP_NESTING";

    private final int threshold;
    private final int maxPaths;

    public DecisionNestingDepthRule() {
        this(AnalysisConfig.DEFAULT_NESTING_THRESHOLD, 0);
    }

    /**
     * @param threshold Report decisions whose nesting depth is at least this
     * @param maxPaths  Paths examined per start/decision pair, 0 for no limit
     */
    public DecisionNestingDepthRule(int threshold, int maxPaths) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be at least 1, got " + threshold);
        }
        this.threshold = threshold;
        this.maxPaths = maxPaths;
    }

    @Override
    public String id() {
        return "nesting-depth";
    }

    @Override
    public String description() {
        return "Decisions nested " + threshold + " or more levels deep";
    }

    public int threshold() {
        return threshold;
    }

    @Override
    public List<AnalysisResult> apply(Flowchart flowchart, FlowGraph graph) {
        List<String> startIds = graph.nodeIdsOfType(NodeType.START);
        if (startIds.isEmpty()) {
            return List.of();
        }

        Set<String> reachable = new ReachabilityAnalyzer(graph).reachableFrom(startIds);
        PathFinder pathFinder = new PathFinder(graph, maxPaths);
        List<AnalysisResult> results = new ArrayList<>();

        for (FlowNode decision : graph.nodesOfType(NodeType.DECISION)) {
            if (!reachable.contains(decision.id())) {
                continue;
            }
            int depth = nestingDepth(graph, pathFinder, startIds, decision.id());
            if (depth >= threshold) {
                results.add(AnalysisResult.info(DEEP_NESTING,
                        "The " + decision.describe("decision node") + " is nested deeply ("
                                + (depth + 1) + " levels). Consider simplifying the logic to improve readability.",
                        List.of(decision.id())));
            }
        }

        return results;
    }

    private static int nestingDepth(FlowGraph graph, PathFinder pathFinder, List<String> startIds, String decisionId) {
        int[] max = {0};
        for (String startId : startIds) {
            pathFinder.forEachSimplePath(startId, decisionId, path -> {
                int count = 0;
                for (int i = 0; i < path.size() - 1; i++) {
                    if (graph.isOfType(path.get(i), NodeType.DECISION)) {
                        count++;
                    }
                }
                max[0] = Math.max(max[0], count);
            });
        }
        return max[0];
    }
}
