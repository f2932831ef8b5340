package io.flowcheck.model;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Complete analysis report: all results plus metadata about the run.
 *
 * @param sourceName        Name of the analyzed flowchart (file name, or "stdin")
 * @param analysisStartTime When the analysis started
 * @param analysisDuration  How long the analysis took
 * @param nodeCount         Number of nodes submitted
 * @param edgeCount         Number of edges that made it into the graph
 * @param droppedEdgeCount  Number of edges dropped for dangling endpoints
 * @param results           All results in rule order
 */
public record AnalysisReport(
        String sourceName,
        Instant analysisStartTime,
        Duration analysisDuration,
        int nodeCount,
        int edgeCount,
        int droppedEdgeCount,
        List<AnalysisResult> results
) {
    public AnalysisReport {
        results = results != null ? List.copyOf(results) : List.of();
    }

    /**
     * Returns true if any result is at or above the given severity.
     */
    public boolean hasResultsAtLeast(Severity threshold) {
        return results.stream().anyMatch(r -> r.isAtLeast(threshold));
    }

    /**
     * Returns the number of results for every severity, including zero counts.
     */
    public Map<Severity, Long> countsBySeverity() {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0L);
        }
        for (AnalysisResult result : results) {
            counts.merge(result.severity(), 1L, Long::sum);
        }
        return counts;
    }

    public long count(Severity severity) {
        return results.stream().filter(r -> r.severity() == severity).count();
    }

    public int totalResults() {
        return results.size();
    }

    public long analysisDurationMs() {
        return analysisDuration != null ? analysisDuration.toMillis() : 0;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String sourceName;
        private Instant analysisStartTime;
        private Duration analysisDuration;
        private int nodeCount;
        private int edgeCount;
        private int droppedEdgeCount;
        private List<AnalysisResult> results = List.of();

        public Builder sourceName(String sourceName) {
            this.sourceName = sourceName;
            return this;
        }

        public Builder analysisStartTime(Instant analysisStartTime) {
            this.analysisStartTime = analysisStartTime;
            return this;
        }

        public Builder analysisDuration(Duration analysisDuration) {
            this.analysisDuration = analysisDuration;
            return this;
        }

        public Builder nodeCount(int nodeCount) {
            this.nodeCount = nodeCount;
            return this;
        }

        public Builder edgeCount(int edgeCount) {
            this.edgeCount = edgeCount;
            return this;
        }

        public Builder droppedEdgeCount(int droppedEdgeCount) {
            this.droppedEdgeCount = droppedEdgeCount;
            return this;
        }

        public Builder results(List<AnalysisResult> results) {
            this.results = results;
            return this;
        }

        public AnalysisReport build() {
            return new AnalysisReport(
                    sourceName,
                    analysisStartTime,
                    analysisDuration,
                    nodeCount,
                    edgeCount,
                    droppedEdgeCount,
                    results
            );
        }
    }
}
