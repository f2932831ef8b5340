package io.flowcheck.rules;

import io.flowcheck.graph.CycleFinder;
import io.flowcheck.graph.FlowGraph;
import io.flowcheck.model.AnalysisResult;
import io.flowcheck.model.Flowchart;
import io.flowcheck.model.NodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Detects loops that have no way out.
 * <p>
 * A simple cycle is accepted only if one of its decision nodes has a successor outside
 * the cycle. Cycles without any decision node are always reported.
 */
public class InfiniteLoopRule implements AnalysisRule {

    private static final Logger log = LoggerFactory.getLogger(InfiniteLoopRule.class);

    public static final String MISSING_LOOP_EXIT = "MISSING_LOOP_EXIT";

    private final int maxCycles;

    public InfiniteLoopRule() {
        this(0);
    }

    /**
     * @param maxCycles Stop after this many cycles, 0 for no limit
     */
    public InfiniteLoopRule(int maxCycles) {
        this.maxCycles = maxCycles;
    }

    @Override
    public String id() {
        return "infinite-loop";
    }

    @Override
    public String description() {
        return "Loops without a decision leading out of the loop";
    }

    @Override
    public List<AnalysisResult> apply(Flowchart flowchart, FlowGraph graph) {
        try {
            return findLoopsWithoutExit(graph);
        } catch (RuntimeException | StackOverflowError e) {
            log.warn("Cycle analysis failed", e);
            return RuleOutcome.failure(name(), e).toResults();
        }
    }

    private List<AnalysisResult> findLoopsWithoutExit(FlowGraph graph) {
        CycleFinder finder = new CycleFinder(graph, maxCycles);
        List<List<String>> cycles = finder.findCycles();
        if (finder.isTruncated()) {
            log.warn("Cycle enumeration stopped after {} cycles", maxCycles);
        }

        List<AnalysisResult> results = new ArrayList<>();
        for (List<String> cycle : cycles) {
            if (!hasExit(graph, cycle)) {
                results.add(AnalysisResult.error(MISSING_LOOP_EXIT,
                        "A potential infinite loop was detected. The identified loop does not appear "
                                + "to have a clear exit condition. Path: " + String.join(" -> ", cycle),
                        cycle));
            }
        }
        return results;
    }

    private static boolean hasExit(FlowGraph graph, List<String> cycle) {
        Set<String> members = new HashSet<>(cycle);
        for (String nodeId : cycle) {
            if (!graph.isOfType(nodeId, NodeType.DECISION)) {
                continue;
            }
            for (String successor : graph.successors(nodeId)) {
                if (!members.contains(successor)) {
                    return true;
                }
            }
        }
        return false;
    }
}
