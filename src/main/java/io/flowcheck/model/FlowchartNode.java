package io.flowcheck.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A node as drawn by the user, before normalization.
 *
 * @param id       Unique id within the flowchart
 * @param value    Display text (may contain HTML from the editor)
 * @param style    Shape descriptor, e.g. "ellipse;whiteSpace=wrap;"
 * @param type     Type hint supplied by the editor (may be null or non-canonical)
 * @param color    Fill color, e.g. "#dae8fc"
 * @param parentId Grouping reference, not used by analysis
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FlowchartNode(
        String id,
        String value,
        String style,
        String type,
        String color,
        String parentId
) {
    /**
     * Creates a node with only the fields analysis cares about.
     */
    public static FlowchartNode of(String id, String value, String style, String type) {
        return new FlowchartNode(id, value, style, type, null, null);
    }
}
