package io.flowcheck.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A directed connector as drawn by the user.
 *
 * @param id       Edge id
 * @param sourceId Id of the node the arrow starts at (may be null or dangling)
 * @param targetId Id of the node the arrow points to (may be null or dangling)
 * @param value    Label, e.g. "yes" / "no" on decision branches
 * @param style    Connector style
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FlowchartEdge(
        String id,
        String sourceId,
        String targetId,
        String value,
        String style
) {
    public static FlowchartEdge of(String id, String sourceId, String targetId) {
        return new FlowchartEdge(id, sourceId, targetId, null, null);
    }
}
