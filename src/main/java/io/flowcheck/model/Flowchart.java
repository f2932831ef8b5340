package io.flowcheck.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.List;

/**
 * A complete flowchart as submitted for analysis.
 * Node and edge order is preserved; it drives the order of results.
 *
 * @param nodes All drawn nodes
 * @param edges All drawn connectors, including ones with dangling endpoints
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Flowchart(
        List<FlowchartNode> nodes,
        List<FlowchartEdge> edges
) {
    /**
     * Compact constructor with validation.
     * Lists may contain nulls from sloppy input, so they are wrapped rather than copied.
     */
    public Flowchart {
        if (nodes == null) {
            throw new InvalidFlowchartException("nodes cannot be null");
        }
        if (edges == null) {
            throw new InvalidFlowchartException("edges cannot be null");
        }
        nodes = Collections.unmodifiableList(nodes);
        edges = Collections.unmodifiableList(edges);
    }

    public static Flowchart of(List<FlowchartNode> nodes, List<FlowchartEdge> edges) {
        return new Flowchart(nodes, edges);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
