package io.flowcheck.rules;

import io.flowcheck.Flowcharts;
import io.flowcheck.model.AnalysisResult;
import io.flowcheck.model.Flowchart;
import io.flowcheck.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InfiniteLoopRuleTest {

    private InfiniteLoopRule rule;

    @BeforeEach
    void setUp() {
        rule = new InfiniteLoopRule();
    }

    private List<AnalysisResult> apply(Flowchart flowchart) {
        return rule.apply(flowchart, Flowcharts.graphOf(flowchart));
    }

    @Test
    void apply_reportsLoopWithoutDecision() {
        Flowchart flowchart = Flowcharts.builder()
                .node("n1", "start").node("n2", "process").node("n3", "process")
                .path("n1", "n2", "n3", "n2")
                .build();

        List<AnalysisResult> results = apply(flowchart);

        assertThat(results).hasSize(1);
        AnalysisResult result = results.get(0);
        assertThat(result.ruleId()).isEqualTo(InfiniteLoopRule.MISSING_LOOP_EXIT);
        assertThat(result.severity()).isEqualTo(Severity.ERROR);
        assertThat(result.elements()).containsExactly("n2", "n3");
        assertThat(result.message()).startsWith("A potential infinite loop was detected.")
                .endsWith("Path: n2 -> n3");
    }

    @Test
    void apply_acceptsLoopWithDecisionLeadingOut() {
        Flowchart flowchart = Flowcharts.builder()
                .node("n1", "start").node("n2", "decision", "i < 10?").node("n3", "process", "i++")
                .node("n4", "end")
                .path("n1", "n2", "n3", "n2")
                .edge("n2", "n4")
                .build();

        assertThat(apply(flowchart)).isEmpty();
    }

    @Test
    void apply_reportsLoopWhoseDecisionStaysInside() {
        Flowchart flowchart = Flowcharts.builder()
                .node("n1", "start").node("n2", "decision", "again?").node("n3", "process").node("n4", "end")
                .path("n1", "n2", "n3", "n2")
                .edge("n3", "n4")
                .build();

        List<AnalysisResult> results = apply(flowchart);

        // n3 leaves the loop but only a decision counts as an exit
        assertThat(results).extracting(AnalysisResult::elements).containsExactly(List.of("n2", "n3"));
    }

    @Test
    void apply_decisionWithExitCoversEveryCycleThroughIt() {
        Flowchart flowchart = Flowcharts.builder()
                .node("n1", "start").node("n2", "decision", "more?").node("n3", "process").node("n4", "process")
                .node("n5", "end")
                .path("n1", "n2", "n3", "n4", "n2")
                .edge("n3", "n2")
                .edge("n2", "n5")
                .build();

        assertThat(apply(flowchart)).isEmpty();
    }

    @Test
    void apply_reportsSelfLoop() {
        Flowchart flowchart = Flowcharts.builder()
                .node("n1", "start").node("n2", "process")
                .path("n1", "n2", "n2")
                .build();

        assertThat(apply(flowchart)).extracting(AnalysisResult::elements).containsExactly(List.of("n2"));
    }

    @Test
    void apply_convertsInternalFailureToSystemError() {
        Flowchart flowchart = Flowcharts.builder().node("n1", "start").build();

        List<AnalysisResult> results = rule.apply(flowchart, null);

        assertThat(results).hasSize(1);
        assertThat(results.get(0).ruleId()).isEqualTo(AnalysisResult.RULE_EXECUTION_ERROR);
        assertThat(results.get(0).severity()).isEqualTo(Severity.SYSTEM_ERROR);
        assertThat(results.get(0).message()).startsWith("Rule 'InfiniteLoopRule' failed to execute: ");
        assertThat(results.get(0).elements()).isEmpty();
    }
}
