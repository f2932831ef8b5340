package io.flowcheck.rules;

import io.flowcheck.graph.FlowGraph;
import io.flowcheck.graph.FlowNode;
import io.flowcheck.model.AnalysisResult;
import io.flowcheck.model.Flowchart;
import io.flowcheck.model.NodeType;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that every decision offers at least two ways forward.
 * Any fan-out of two or more is accepted.
 */
public class ParallelBranchBalanceRule implements AnalysisRule {

    public static final String DECISION_NO_BRANCHES = "DECISION_NO_BRANCHES";
    public static final String DECISION_SINGLE_BRANCH = "DECISION_SINGLE_BRANCH";

    @Override
    public String id() {
        return "branch-balance";
    }

    @Override
    public String description() {
        return "Decisions with fewer than two exit paths";
    }

    @Override
    public List<AnalysisResult> apply(Flowchart flowchart, FlowGraph graph) {
        List<AnalysisResult> results = new ArrayList<>();

        for (FlowNode decision : graph.nodesOfType(NodeType.DECISION)) {
            int branches = graph.outDegree(decision.id());
            String repr = decision.describe("decision node");
            if (branches == 0) {
                results.add(AnalysisResult.error(DECISION_NO_BRANCHES,
                        "The " + repr + " is a dead end. Decision nodes must have exit paths.",
                        List.of(decision.id())));
            } else if (branches == 1) {
                results.add(AnalysisResult.warning(DECISION_SINGLE_BRANCH,
                        "The " + repr + " has only one exit path. A decision should offer at least "
                                + "two alternative branches to be meaningful.",
                        List.of(decision.id())));
            }
        }

        return results;
    }
}
