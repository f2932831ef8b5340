package io.flowcheck.analysis;

import io.flowcheck.AnalysisConfig;
import io.flowcheck.graph.FlowGraph;
import io.flowcheck.model.AnalysisReport;
import io.flowcheck.model.AnalysisResult;
import io.flowcheck.model.Flowchart;
import io.flowcheck.model.FlowchartEdge;
import io.flowcheck.model.InvalidFlowchartException;
import io.flowcheck.rules.RuleEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Entry point for analyzing a flowchart.
 * <p>
 * Builds the graph, runs the rule engine and appends one {@code DANGLING_EDGE} warning per
 * edge that could not be added to the graph. An empty flowchart yields a single
 * {@code EMPTY_DATA_RECEIVED} warning without running any rule.
 * <p>
 * Instances hold no per-analysis state and can be shared between threads.
 */
public class FlowchartAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(FlowchartAnalyzer.class);

    public static final String EMPTY_DATA_RECEIVED = "EMPTY_DATA_RECEIVED";
    public static final String DANGLING_EDGE = "DANGLING_EDGE";

    private final FlowGraphBuilder graphBuilder;
    private final RuleEngine ruleEngine;
    private final Set<String> selectedRules;

    public FlowchartAnalyzer() {
        this(AnalysisConfig.defaults());
    }

    public FlowchartAnalyzer(AnalysisConfig config) {
        this(new FlowGraphBuilder(), RuleEngine.createDefault(config), null);
    }

    /**
     * @param graphBuilder  Builds the graph from the drawn flowchart
     * @param ruleEngine    Rules to run
     * @param selectedRules Ids of the rules to run, or null for all of them
     */
    public FlowchartAnalyzer(FlowGraphBuilder graphBuilder, RuleEngine ruleEngine, Set<String> selectedRules) {
        this.graphBuilder = graphBuilder;
        this.ruleEngine = ruleEngine;
        this.selectedRules = selectedRules != null ? Set.copyOf(selectedRules) : null;
    }

    /**
     * Returns a copy of this analyzer that only runs the given rules.
     *
     * @throws IllegalArgumentException if a rule id is not registered
     */
    public FlowchartAnalyzer withRules(Set<String> ruleIds) {
        for (String id : ruleIds) {
            if (ruleEngine.getById(id).isEmpty()) {
                throw new IllegalArgumentException("Unknown rule id: " + id);
            }
        }
        return new FlowchartAnalyzer(graphBuilder, ruleEngine, ruleIds);
    }

    public RuleEngine ruleEngine() {
        return ruleEngine;
    }

    public AnalysisReport analyze(Flowchart flowchart) {
        return analyze(flowchart, null);
    }

    /**
     * Analyzes a flowchart.
     *
     * @param flowchart  The flowchart to check
     * @param sourceName Name shown in reports, may be null
     * @return The report, whose results are never null
     * @throws InvalidFlowchartException if the flowchart is null or a node has no id
     */
    public AnalysisReport analyze(Flowchart flowchart, String sourceName) {
        if (flowchart == null) {
            throw new InvalidFlowchartException("flowchart cannot be null");
        }
        Instant start = Instant.now();

        if (flowchart.isEmpty()) {
            log.debug("Received an empty flowchart");
            return AnalysisReport.builder()
                    .sourceName(sourceName)
                    .analysisStartTime(start)
                    .analysisDuration(Duration.between(start, Instant.now()))
                    .results(List.of(AnalysisResult.warning(EMPTY_DATA_RECEIVED,
                            "The flowchart is empty or could not be captured correctly. "
                                    + "Please ensure your flowchart is not blank and try again.",
                            List.of())))
                    .build();
        }

        FlowGraph graph = graphBuilder.build(flowchart);

        List<AnalysisResult> results = new ArrayList<>(selectedRules == null
                ? ruleEngine.run(flowchart, graph)
                : ruleEngine.run(flowchart, graph, selectedRules));
        for (FlowchartEdge dropped : graph.droppedEdges()) {
            results.add(danglingEdge(dropped, graph));
        }

        Duration duration = Duration.between(start, Instant.now());
        log.debug("Analyzed flowchart: {} nodes, {} edges, {} results in {} ms",
                graph.nodeCount(), graph.edgeCount(), results.size(), duration.toMillis());

        return AnalysisReport.builder()
                .sourceName(sourceName)
                .analysisStartTime(start)
                .analysisDuration(duration)
                .nodeCount(graph.nodeCount())
                .edgeCount(graph.edgeCount())
                .droppedEdgeCount(graph.droppedEdges().size())
                .results(results)
                .build();
    }

    /**
     * Builds the normalized graph for downstream consumers without running any rule.
     */
    public FlowGraph buildGraph(Flowchart flowchart) {
        return graphBuilder.build(flowchart);
    }

    private static AnalysisResult danglingEdge(FlowchartEdge edge, FlowGraph graph) {
        List<String> existing = new ArrayList<>();
        if (graph.hasNode(edge.sourceId())) {
            existing.add(edge.sourceId());
        }
        if (graph.hasNode(edge.targetId()) && !existing.contains(edge.targetId())) {
            existing.add(edge.targetId());
        }
        String edgeName = edge.id() != null ? "'" + edge.id() + "'" : "without id";
        return AnalysisResult.warning(DANGLING_EDGE,
                "The connector " + edgeName + " was ignored because it does not connect two existing symbols "
                        + "(source: " + edge.sourceId() + ", target: " + edge.targetId() + ").",
                existing);
    }
}
