package io.flowcheck.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Canonical semantic roles a flowchart node can take after normalization.
 */
public enum NodeType {
    /**
     * Entry point of the program.
     * Usually drawn as an ellipse labelled "Start".
     */
    START("start"),

    /**
     * Exit point of the program.
     * Usually drawn as an ellipse labelled "End" or "Stop".
     */
    END("end"),

    /**
     * A computation step, drawn as a rectangle.
     */
    PROCESS("process"),

    /**
     * A branching condition, drawn as a rhombus or diamond.
     */
    DECISION("decision"),

    /**
     * Reading data, drawn as a parallelogram.
     */
    INPUT("input"),

    /**
     * Writing data, drawn as a parallelogram.
     */
    OUTPUT("output"),

    /**
     * A call to a named function or procedure.
     */
    SUBROUTINE("subroutine");

    private final String label;

    NodeType(String label) {
        this.label = label;
    }

    /**
     * Lower-case label used on the wire and in messages.
     */
    public String label() {
        return label;
    }

    /**
     * Resolves a canonical label, case-insensitively.
     * Returns empty for null, blank or unknown labels.
     */
    public static Optional<NodeType> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (NodeType type : values()) {
            if (type.label.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return label;
    }
}
