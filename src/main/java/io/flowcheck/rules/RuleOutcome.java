package io.flowcheck.rules;

import io.flowcheck.model.AnalysisResult;

import java.util.List;

/**
 * Outcome of running one rule: either its results or the reason it failed.
 *
 * @param ruleName Name of the rule that ran
 * @param results  Results on success, empty on failure
 * @param failure  The failure, or null on success
 */
public record RuleOutcome(
        String ruleName,
        List<AnalysisResult> results,
        Throwable failure
) {
    public RuleOutcome {
        results = results != null ? List.copyOf(results) : List.of();
    }

    public static RuleOutcome success(String ruleName, List<AnalysisResult> results) {
        return new RuleOutcome(ruleName, results, null);
    }

    public static RuleOutcome failure(String ruleName, Throwable failure) {
        return new RuleOutcome(ruleName, List.of(), failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * Returns the rule's results, or a single {@code RULE_EXECUTION_ERROR} result
     * with severity {@code system_error} when the rule failed.
     */
    public List<AnalysisResult> toResults() {
        if (isSuccess()) {
            return results;
        }
        return List.of(AnalysisResult.ruleExecutionError(ruleName, failureReason()));
    }

    /**
     * Returns the failure message, falling back to the exception type when it has none.
     */
    public String failureReason() {
        if (failure == null) {
            return "";
        }
        String message = failure.getMessage();
        return message != null && !message.isBlank() ? message : failure.getClass().getSimpleName();
    }
}
