package io.flowcheck.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of an analysis result.
 * Lower rank = more severe.
 */
public enum Severity {
    /**
     * The rule itself failed to run. Not a defect of the flowchart.
     */
    SYSTEM_ERROR(0, "system_error"),

    /**
     * The flowchart is structurally wrong.
     * Examples: no start symbol, loop without exit.
     */
    ERROR(1, "error"),

    /**
     * Likely a mistake worth fixing.
     * Examples: unconnected symbol, unreachable step.
     */
    WARNING(2, "warning"),

    /**
     * Pedagogical hint, no defect.
     */
    INFO(3, "info");

    private final int rank;
    private final String label;

    Severity(int rank, String label) {
        this.rank = rank;
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Returns true if this severity is at least as severe as the given threshold.
     */
    public boolean isAtLeast(Severity threshold) {
        return this.rank <= threshold.rank;
    }

    /**
     * Parses a wire label such as "warning" or "system_error".
     *
     * @throws IllegalArgumentException for unknown labels
     */
    public static Severity fromLabel(String label) {
        if (label != null) {
            String normalized = label.trim().toLowerCase(Locale.ROOT).replace('-', '_');
            for (Severity severity : values()) {
                if (severity.label.equals(normalized)) {
                    return severity;
                }
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + label);
    }
}
