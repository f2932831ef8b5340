package io.flowcheck.report;

import io.flowcheck.model.AnalysisReport;
import io.flowcheck.model.AnalysisResult;
import io.flowcheck.model.Severity;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.List;

/**
 * Formats analysis results for console output with ANSI colors.
 * <p>
 * Layout:
 * - Header with the analyzed source
 * - Summary with graph size and counts per severity
 * - Results grouped by severity, most severe first
 * - Feedback messages for the student
 */
public class ConsoleReporter implements Reporter {

    // ANSI color codes
    private static final String RESET = "\u001B[0m";
    private static final String BOLD = "\u001B[1m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String GREEN = "\u001B[32m";
    private static final String CYAN = "\u001B[36m";
    private static final String MAGENTA = "\u001B[35m";

    private final boolean useColors;
    private final boolean showFeedback;
    private final FeedbackFormatter feedbackFormatter;

    public ConsoleReporter() {
        this(true, true);
    }

    public ConsoleReporter(boolean useColors) {
        this(useColors, true);
    }

    public ConsoleReporter(boolean useColors, boolean showFeedback) {
        this.useColors = useColors;
        this.showFeedback = showFeedback;
        this.feedbackFormatter = new FeedbackFormatter();
    }

    @Override
    public void write(AnalysisReport report, Writer writer) throws IOException {
        PrintWriter out = new PrintWriter(writer);

        printHeader(out, report);
        printSummary(out, report);

        for (Severity severity : Severity.values()) {
            List<AnalysisResult> results = report.results().stream()
                    .filter(r -> r.severity() == severity)
                    .toList();
            if (!results.isEmpty()) {
                printSeveritySection(out, severity, results);
            }
        }

        if (showFeedback) {
            printFeedback(out, report);
        }

        printFooter(out, report);
        out.flush();
    }

    private void printHeader(PrintWriter out, AnalysisReport report) {
        out.println();
        out.println(line('=', 70));
        out.println(center("FLOWCHART ANALYSIS REPORT", 70));
        out.println(line('=', 70));
        out.println();

        if (report.sourceName() != null) {
            out.println("Flowchart: " + report.sourceName());
        }
        if (report.analysisStartTime() != null) {
            out.println("Analyzed: " + report.analysisStartTime());
        }
        out.println();
    }

    private void printSummary(PrintWriter out, AnalysisReport report) {
        out.println(bold("SUMMARY"));
        out.println(line('-', 70));

        String stats = String.format("Symbols: %d | Connectors: %d | Ignored connectors: %d | %d ms",
                report.nodeCount(),
                report.edgeCount(),
                report.droppedEdgeCount(),
                report.analysisDurationMs());
        out.println(stats);

        StringBuilder counts = new StringBuilder("Results: ");
        long errors = report.count(Severity.ERROR);
        long warnings = report.count(Severity.WARNING);
        long infos = report.count(Severity.INFO);
        long systemErrors = report.count(Severity.SYSTEM_ERROR);

        counts.append(errors > 0 ? color(RED, errors + " error(s)") : "0 error(s)").append(" | ");
        counts.append(warnings > 0 ? color(YELLOW, warnings + " warning(s)") : "0 warning(s)").append(" | ");
        counts.append(infos).append(" info");
        if (systemErrors > 0) {
            counts.append(" | ").append(color(MAGENTA, systemErrors + " rule failure(s)"));
        }
        out.println(counts);
        out.println();
    }

    private void printSeveritySection(PrintWriter out, Severity severity, List<AnalysisResult> results) {
        out.println(color(severityColor(severity), bold(sectionTitle(severity) + " (" + results.size() + ")")));
        out.println(line('-', 70));

        for (AnalysisResult result : results) {
            out.println("  [" + result.ruleId() + "] " + result.message());
            if (!result.elements().isEmpty()) {
                out.println("    Elements: " + String.join(", ", result.elements()));
            }
        }
        out.println();
    }

    private void printFeedback(PrintWriter out, AnalysisReport report) {
        out.println(bold("FEEDBACK"));
        out.println(line('-', 70));
        for (String message : feedbackFormatter.format(report.results())) {
            out.println("  " + message);
        }
        out.println();
    }

    private void printFooter(PrintWriter out, AnalysisReport report) {
        out.println(line('=', 70));

        long errors = report.count(Severity.ERROR) + report.count(Severity.SYSTEM_ERROR);
        long warnings = report.count(Severity.WARNING);

        if (errors > 0) {
            out.println(color(RED, bold("ACTION REQUIRED: " + errors + " error(s) must be fixed.")));
        } else if (warnings > 0) {
            out.println(color(YELLOW, "ATTENTION: " + warnings + " warning(s) should be reviewed."));
        } else {
            out.println(color(GREEN, "No structural problems found."));
        }

        out.println(line('=', 70));
    }

    private static String sectionTitle(Severity severity) {
        return switch (severity) {
            case SYSTEM_ERROR -> "RULE FAILURES";
            case ERROR -> "ERRORS";
            case WARNING -> "WARNINGS";
            case INFO -> "HINTS";
        };
    }

    private static String severityColor(Severity severity) {
        return switch (severity) {
            case SYSTEM_ERROR -> MAGENTA;
            case ERROR -> RED;
            case WARNING -> YELLOW;
            case INFO -> CYAN;
        };
    }

    private String color(String color, String text) {
        if (!useColors) return text;
        return color + text + RESET;
    }

    private String bold(String text) {
        if (!useColors) return text;
        return BOLD + text + RESET;
    }

    private String line(char c, int length) {
        return String.valueOf(c).repeat(length);
    }

    private String center(String text, int width) {
        if (text.length() >= width) return text;
        int padding = (width - text.length()) / 2;
        return " ".repeat(padding) + text;
    }
}
