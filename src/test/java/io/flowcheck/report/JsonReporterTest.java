package io.flowcheck.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.flowcheck.model.AnalysisReport;
import io.flowcheck.model.AnalysisResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonReporterTest {

    private AnalysisReport report;
    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
        report = AnalysisReport.builder()
                .sourceName("loop.json")
                .analysisStartTime(Instant.parse("2024-05-01T10:15:30Z"))
                .analysisDuration(Duration.ofMillis(12))
                .nodeCount(3)
                .edgeCount(3)
                .results(List.of(
                        AnalysisResult.error("MISSING_LOOP_EXIT", "Path: n2 -> n3", List.of("n2", "n3")),
                        AnalysisResult.warning("UNREACHABLE_CODE", "The element (ID: n4) is unreachable from any start node.",
                                List.of("n4"))))
                .build();
    }

    @Test
    void write_producesResultsFeedbackAndSummary() throws IOException {
        JsonNode json = mapper.readTree(new JsonReporter().toString(report));

        JsonNode first = json.get("analysisResults").get(0);
        assertThat(first.get("ruleId").asText()).isEqualTo("MISSING_LOOP_EXIT");
        assertThat(first.get("severity").asText()).isEqualTo("error");
        assertThat(first.get("elements")).hasSize(2);

        assertThat(json.get("feedbackMessages")).hasSize(2);

        JsonNode summary = json.get("summary");
        assertThat(summary.get("source").asText()).isEqualTo("loop.json");
        assertThat(summary.get("analysisStartTime").asText()).isEqualTo("2024-05-01T10:15:30Z");
        assertThat(summary.get("errors").asLong()).isEqualTo(1);
        assertThat(summary.get("warnings").asLong()).isEqualTo(1);
        assertThat(summary.get("systemErrors").asLong()).isZero();
        assertThat(summary.get("total").asInt()).isEqualTo(2);
    }

    @Test
    void write_omitsMissingSourceName() throws IOException {
        AnalysisReport anonymous = AnalysisReport.builder().results(List.of()).build();

        JsonNode json = mapper.readTree(new JsonReporter(false).toString(anonymous));

        assertThat(json.get("summary").has("source")).isFalse();
        assertThat(json.get("feedbackMessages").get(0).asText()).isEqualTo(FeedbackFormatter.ALL_GOOD);
    }

    @Test
    void write_toFile(@TempDir Path tempDir) throws IOException {
        Path out = tempDir.resolve("report.json");

        new JsonReporter().write(report, out);

        assertThat(mapper.readTree(Files.readString(out)).get("analysisResults")).hasSize(2);
    }
}
