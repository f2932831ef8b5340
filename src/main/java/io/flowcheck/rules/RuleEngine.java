package io.flowcheck.rules;

import io.flowcheck.AnalysisConfig;
import io.flowcheck.graph.FlowGraph;
import io.flowcheck.model.AnalysisResult;
import io.flowcheck.model.Flowchart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ordered registry of analysis rules.
 * Runs rules one after another and concatenates their results in registration order.
 * A rule that throws is reported as a single {@code RULE_EXECUTION_ERROR} result
 * and the remaining rules still run.
 */
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final List<AnalysisRule> rules;

    private RuleEngine(List<AnalysisRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Creates an engine with all default rules and default settings.
     */
    public static RuleEngine createDefault() {
        return createDefault(AnalysisConfig.defaults());
    }

    /**
     * Creates an engine with the default rules configured from the given settings.
     * Disabled rules are left out; the order of the others is unchanged.
     *
     * @throws IllegalArgumentException if a disabled rule id is unknown
     */
    public static RuleEngine createDefault(AnalysisConfig config) {
        List<AnalysisRule> all = defaultRules(config);
        Set<String> knownIds = all.stream().map(AnalysisRule::id).collect(Collectors.toSet());
        for (String disabled : config.getDisabledRules()) {
            if (!knownIds.contains(disabled)) {
                throw new IllegalArgumentException("Unknown rule id: " + disabled
                        + ". Valid ids: " + String.join(", ", ruleIds(all)));
            }
        }
        return new RuleEngine(all.stream()
                .filter(rule -> config.isRuleEnabled(rule.id()))
                .toList());
    }

    /**
     * Creates an engine with specific rules, in the given order.
     */
    public static RuleEngine of(AnalysisRule... rules) {
        return new RuleEngine(Arrays.asList(rules));
    }

    private static List<AnalysisRule> defaultRules(AnalysisConfig config) {
        return List.of(
                new SingleStartMultipleEndRule(),
                new UnconnectedSymbolsRule(),
                new InfiniteLoopRule(config.getMaxCycles()),
                new UnreachableCodeRule(),
                new ParallelBranchBalanceRule(),
                new OrphanedIoRule(),
                new DecisionNestingDepthRule(config.getNestingThreshold(), config.getMaxPaths())
        );
    }

    private static List<String> ruleIds(List<AnalysisRule> rules) {
        return rules.stream().map(AnalysisRule::id).toList();
    }

    /**
     * Runs all rules and returns the aggregated results.
     *
     * @param flowchart The flowchart as drawn
     * @param graph     The graph built from it
     * @return All results, in rule order, never null
     */
    public List<AnalysisResult> run(Flowchart flowchart, FlowGraph graph) {
        List<AnalysisResult> allResults = new ArrayList<>();
        for (AnalysisRule rule : rules) {
            allResults.addAll(execute(rule, flowchart, graph).toResults());
        }
        return allResults;
    }

    /**
     * Runs specific rules by id, keeping registration order.
     */
    public List<AnalysisResult> run(Flowchart flowchart, FlowGraph graph, Set<String> ruleIds) {
        List<AnalysisResult> allResults = new ArrayList<>();
        for (AnalysisRule rule : rules) {
            if (ruleIds.contains(rule.id())) {
                allResults.addAll(execute(rule, flowchart, graph).toResults());
            }
        }
        return allResults;
    }

    /**
     * Runs a single rule, capturing any failure instead of propagating it.
     */
    public static RuleOutcome execute(AnalysisRule rule, Flowchart flowchart, FlowGraph graph) {
        try {
            List<AnalysisResult> results = rule.apply(flowchart, graph);
            return RuleOutcome.success(rule.name(), results != null ? results : List.of());
        } catch (RuntimeException | StackOverflowError e) {
            log.warn("Error during rule execution '{}'", rule.name(), e);
            return RuleOutcome.failure(rule.name(), e);
        }
    }

    /**
     * Returns all registered rules in execution order.
     */
    public List<AnalysisRule> allRules() {
        return rules;
    }

    /**
     * Returns a rule by id, if present.
     */
    public Optional<AnalysisRule> getById(String id) {
        return rules.stream()
                .filter(r -> r.id().equals(id))
                .findFirst();
    }
}
