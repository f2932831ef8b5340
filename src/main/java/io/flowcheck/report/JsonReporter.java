package io.flowcheck.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.flowcheck.model.AnalysisReport;
import io.flowcheck.model.AnalysisResult;
import io.flowcheck.model.Severity;

import java.io.IOException;
import java.io.Writer;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Formats analysis results as JSON for machine processing.
 */
public class JsonReporter implements Reporter {

    private final ObjectMapper mapper;
    private final boolean prettyPrint;
    private final FeedbackFormatter feedbackFormatter;

    public JsonReporter() {
        this(true);
    }

    public JsonReporter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
        this.mapper = createMapper();
        this.feedbackFormatter = new FeedbackFormatter();
    }

    private ObjectMapper createMapper() {
        ObjectMapper m = new ObjectMapper();
        m.registerModule(new JavaTimeModule());
        m.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // The caller owns the writer, which may be stdout
        m.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        if (prettyPrint) {
            m.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return m;
    }

    @Override
    public void write(AnalysisReport report, Writer writer) throws IOException {
        mapper.writeValue(writer, toJsonReport(report));
    }

    JsonReport toJsonReport(AnalysisReport report) {
        Map<Severity, Long> counts = report.countsBySeverity();

        return new JsonReport(
                report.results().stream()
                        .map(JsonReporter::toJsonResult)
                        .toList(),
                feedbackFormatter.format(report.results()),
                new JsonReport.Summary(
                        report.sourceName(),
                        report.analysisStartTime(),
                        report.analysisDurationMs(),
                        report.nodeCount(),
                        report.edgeCount(),
                        report.droppedEdgeCount(),
                        counts.get(Severity.SYSTEM_ERROR),
                        counts.get(Severity.ERROR),
                        counts.get(Severity.WARNING),
                        counts.get(Severity.INFO),
                        report.totalResults()
                )
        );
    }

    private static JsonReport.Result toJsonResult(AnalysisResult result) {
        return new JsonReport.Result(
                result.ruleId(),
                result.message(),
                result.severity().label(),
                result.elements()
        );
    }

    /**
     * JSON structure for the report.
     */
    public record JsonReport(
            List<Result> analysisResults,
            List<String> feedbackMessages,
            Summary summary
    ) {
        public record Result(
                String ruleId,
                String message,
                String severity,
                List<String> elements
        ) {}

        public record Summary(
                String source,
                Instant analysisStartTime,
                long analysisDurationMs,
                int nodes,
                int edges,
                int droppedEdges,
                long systemErrors,
                long errors,
                long warnings,
                long infos,
                int total
        ) {}
    }
}
