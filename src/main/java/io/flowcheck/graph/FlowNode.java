package io.flowcheck.graph;

import io.flowcheck.model.NodeType;
import io.flowcheck.model.SubroutineInfo;

import java.util.Optional;

/**
 * A node of the analysis graph, carrying its canonical type.
 *
 * @param id         Node id (unique within the graph)
 * @param type       Canonical type assigned by the normalizer
 * @param value      Display text as drawn (may be null)
 * @param color      Fill color (may be null)
 * @param parentId   Grouping reference (may be null)
 * @param subroutine Parsed signature, only for {@link NodeType#SUBROUTINE} nodes (null otherwise)
 */
public record FlowNode(
        String id,
        NodeType type,
        String value,
        String color,
        String parentId,
        SubroutineInfo subroutine
) {
    public FlowNode {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("id cannot be null or empty");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
    }

    public static FlowNode of(String id, NodeType type, String value) {
        return new FlowNode(id, type, value, null, null, null);
    }

    public boolean is(NodeType other) {
        return type == other;
    }

    public boolean hasValue() {
        return value != null && !value.isEmpty();
    }

    public Optional<SubroutineInfo> subroutineInfo() {
        return Optional.ofNullable(subroutine);
    }

    /**
     * Describes the node for messages: {@code 'Read x' (ID: n2)} when it has text,
     * otherwise {@code <fallback> (ID: n2)}.
     */
    public String describe(String fallback) {
        if (hasValue()) {
            return "'" + value + "' (ID: " + id + ")";
        }
        return fallback + " (ID: " + id + ")";
    }

    /**
     * Display text, or the id when the node has no text.
     */
    public String displayName() {
        return hasValue() ? value : id;
    }
}
