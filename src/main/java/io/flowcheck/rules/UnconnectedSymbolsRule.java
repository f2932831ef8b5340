package io.flowcheck.rules;

import io.flowcheck.graph.FlowGraph;
import io.flowcheck.graph.FlowNode;
import io.flowcheck.model.AnalysisResult;
import io.flowcheck.model.Flowchart;
import io.flowcheck.model.FlowchartEdge;
import io.flowcheck.model.NodeType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags symbols that are missing incoming or outgoing connections.
 * <p>
 * Connection counts come from the drawn edge list, so an edge counts for the endpoint
 * that exists even when the other endpoint is missing.
 */
public class UnconnectedSymbolsRule implements AnalysisRule {

    public static final String UNCONNECTED_SYMBOL_BOTH = "UNCONNECTED_SYMBOL_BOTH";
    public static final String UNCONNECTED_SYMBOL_NO_INCOMING = "UNCONNECTED_SYMBOL_NO_INCOMING";
    public static final String UNCONNECTED_SYMBOL_NO_OUTGOING = "UNCONNECTED_SYMBOL_NO_OUTGOING";
    public static final String START_SYMBOL_NO_OUTGOING = "START_SYMBOL_NO_OUTGOING";
    public static final String END_SYMBOL_NO_INCOMING = "END_SYMBOL_NO_INCOMING";

    @Override
    public String id() {
        return "unconnected-symbols";
    }

    @Override
    public String description() {
        return "Symbols missing incoming or outgoing connections";
    }

    @Override
    public List<AnalysisResult> apply(Flowchart flowchart, FlowGraph graph) {
        Map<String, Integer> incoming = new HashMap<>();
        Map<String, Integer> outgoing = new HashMap<>();

        for (FlowchartEdge edge : flowchart.edges()) {
            if (edge == null) {
                continue;
            }
            if (graph.hasNode(edge.sourceId())) {
                outgoing.merge(edge.sourceId(), 1, Integer::sum);
            }
            if (graph.hasNode(edge.targetId())) {
                incoming.merge(edge.targetId(), 1, Integer::sum);
            }
        }

        boolean singleNode = graph.nodeCount() <= 1;
        List<AnalysisResult> results = new ArrayList<>();

        for (FlowNode node : graph.allNodes()) {
            boolean hasIncoming = incoming.getOrDefault(node.id(), 0) > 0;
            boolean hasOutgoing = outgoing.getOrDefault(node.id(), 0) > 0;
            String label = "'" + node.displayName() + "' (" + node.id() + ")";

            if (node.is(NodeType.START)) {
                if (!hasOutgoing && !singleNode) {
                    results.add(warning(START_SYMBOL_NO_OUTGOING,
                            "Start symbol " + label + " has no outgoing connections.", node));
                }
            } else if (node.is(NodeType.END)) {
                if (!hasIncoming && !singleNode) {
                    results.add(warning(END_SYMBOL_NO_INCOMING,
                            "End symbol " + label + " has no incoming connections.", node));
                }
            } else if (!hasIncoming && !hasOutgoing) {
                results.add(warning(UNCONNECTED_SYMBOL_BOTH,
                        "Symbol " + label + " is fully unconnected.", node));
            } else if (!hasIncoming) {
                results.add(warning(UNCONNECTED_SYMBOL_NO_INCOMING,
                        "Symbol " + label + " has no incoming connections.", node));
            } else if (!hasOutgoing) {
                results.add(warning(UNCONNECTED_SYMBOL_NO_OUTGOING,
                        "Symbol " + label + " has no outgoing connections.", node));
            }
        }

        return results;
    }

    private static AnalysisResult warning(String ruleId, String message, FlowNode node) {
        return AnalysisResult.warning(ruleId, message, List.of(node.id()));
    }
}
