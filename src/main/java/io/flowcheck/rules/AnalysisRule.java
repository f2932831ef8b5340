package io.flowcheck.rules;

import io.flowcheck.graph.FlowGraph;
import io.flowcheck.model.AnalysisResult;
import io.flowcheck.model.Flowchart;

import java.util.List;

/**
 * Base interface for all analysis rules.
 * Each rule checks the flowchart graph for one kind of structural, logical or pedagogical issue.
 */
public interface AnalysisRule {

    /**
     * Returns a unique identifier for this rule.
     */
    String id();

    /**
     * Returns a human-readable description of what this rule checks.
     */
    String description();

    /**
     * Applies the rule.
     * Implementations must treat both arguments as read-only.
     *
     * @param flowchart The flowchart as drawn, including edges that were dropped from the graph
     * @param graph     The normalized graph built from it
     * @return Results from this rule, empty if nothing was found
     */
    List<AnalysisResult> apply(Flowchart flowchart, FlowGraph graph);

    /**
     * Name used in messages about this rule, the simple class name by default.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
