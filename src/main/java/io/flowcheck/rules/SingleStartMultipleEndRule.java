package io.flowcheck.rules;

import io.flowcheck.graph.FlowGraph;
import io.flowcheck.model.AnalysisResult;
import io.flowcheck.model.Flowchart;
import io.flowcheck.model.NodeType;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that the flowchart has exactly one start symbol and at least one end symbol.
 * Several end symbols are allowed.
 */
public class SingleStartMultipleEndRule implements AnalysisRule {

    public static final String NO_START_SYMBOL = "NO_START_SYMBOL";
    public static final String MULTIPLE_START_SYMBOLS = "MULTIPLE_START_SYMBOLS";
    public static final String NO_END_SYMBOL = "NO_END_SYMBOL";

    @Override
    public String id() {
        return "start-end";
    }

    @Override
    public String description() {
        return "Flowchart has exactly one start symbol and at least one end symbol";
    }

    @Override
    public List<AnalysisResult> apply(Flowchart flowchart, FlowGraph graph) {
        List<AnalysisResult> results = new ArrayList<>();

        List<String> startIds = graph.nodeIdsOfType(NodeType.START);
        if (startIds.isEmpty()) {
            results.add(AnalysisResult.error(NO_START_SYMBOL,
                    "The flowchart must have exactly one start symbol, but none was found.",
                    List.of()));
        } else if (startIds.size() > 1) {
            results.add(AnalysisResult.error(MULTIPLE_START_SYMBOLS,
                    "The flowchart must have exactly one start symbol, but " + startIds.size() + " were found.",
                    startIds));
        }

        if (graph.nodeIdsOfType(NodeType.END).isEmpty()) {
            results.add(AnalysisResult.error(NO_END_SYMBOL,
                    "The flowchart must have at least one end symbol, but none was found.",
                    List.of()));
        }

        return results;
    }
}
