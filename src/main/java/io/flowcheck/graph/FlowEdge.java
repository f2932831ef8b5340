package io.flowcheck.graph;

/**
 * A directed edge between two nodes that both exist in the graph.
 *
 * @param id       Edge id as drawn (may be null)
 * @param sourceId Source node id
 * @param targetId Target node id
 * @param value    Branch label (may be null)
 */
public record FlowEdge(
        String id,
        String sourceId,
        String targetId,
        String value
) {
    public FlowEdge {
        if (sourceId == null || targetId == null) {
            throw new IllegalArgumentException("edge endpoints cannot be null");
        }
    }
}
