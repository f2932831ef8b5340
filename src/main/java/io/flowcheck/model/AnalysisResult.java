package io.flowcheck.model;

import java.util.List;

/**
 * A single diagnostic produced by an analysis rule.
 *
 * @param ruleId   Stable tag such as "MISSING_LOOP_EXIT"
 * @param message  Human-readable description, may reference node ids and values
 * @param severity How serious the issue is
 * @param elements Ids of the involved nodes, in a meaningful order (may be empty)
 */
public record AnalysisResult(
        String ruleId,
        String message,
        Severity severity,
        List<String> elements
) {
    /**
     * Rule id of the synthetic result emitted when a rule fails internally.
     */
    public static final String RULE_EXECUTION_ERROR = "RULE_EXECUTION_ERROR";

    /**
     * Compact constructor with validation.
     */
    public AnalysisResult {
        if (ruleId == null || ruleId.isBlank()) {
            throw new IllegalArgumentException("ruleId cannot be null or blank");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        if (message == null) {
            message = "";
        }
        elements = elements != null ? List.copyOf(elements) : List.of();
    }

    public static AnalysisResult error(String ruleId, String message, List<String> elements) {
        return new AnalysisResult(ruleId, message, Severity.ERROR, elements);
    }

    public static AnalysisResult warning(String ruleId, String message, List<String> elements) {
        return new AnalysisResult(ruleId, message, Severity.WARNING, elements);
    }

    public static AnalysisResult info(String ruleId, String message, List<String> elements) {
        return new AnalysisResult(ruleId, message, Severity.INFO, elements);
    }

    /**
     * Builds the result that stands in for a rule that threw.
     */
    public static AnalysisResult ruleExecutionError(String ruleName, String reason) {
        return new AnalysisResult(
                RULE_EXECUTION_ERROR,
                "Rule '" + ruleName + "' failed to execute: " + reason,
                Severity.SYSTEM_ERROR,
                List.of()
        );
    }

    public boolean isAtLeast(Severity threshold) {
        return severity.isAtLeast(threshold);
    }
}
