package io.flowcheck;

import io.flowcheck.analysis.FlowchartAnalyzer;
import io.flowcheck.analysis.FlowchartLoader;
import io.flowcheck.model.AnalysisReport;
import io.flowcheck.model.Flowchart;
import io.flowcheck.model.InvalidFlowchartException;
import io.flowcheck.model.Severity;
import io.flowcheck.report.ConsoleReporter;
import io.flowcheck.report.JsonReporter;
import io.flowcheck.report.Reporter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI entry point for the flow-check tool.
 */
@Command(
        name = "flow-check",
        mixinStandardHelpOptions = true,
        version = "flow-check 1.0.0",
        description = "Checks flowcharts for structural, logical and pedagogical problems.",
        footer = {
                "",
                "Rule ids: start-end, unconnected-symbols, infinite-loop, unreachable-code,",
                "          branch-balance, orphaned-io, nesting-depth",
                "",
                "Examples:",
                "  flow-check diagram.json",
                "  flow-check diagram.json --output-format json --output-file result.json",
                "  flow-check diagram.json --rules infinite-loop,unreachable-code --fail-on warning",
                "  cat diagram.json | flow-check -"
        }
)
public class FlowCheckCli implements Callable<Integer> {

    static final String CONFIG_FILE_NAME = "flow-check.yaml";

    @Parameters(
            index = "0",
            description = "Flowchart JSON file with 'nodes' and 'edges' arrays, or '-' to read stdin"
    )
    private String input;

    @Option(
            names = {"-o", "--output-format"},
            description = "Output format: console (default), json",
            defaultValue = "console"
    )
    private OutputFormat outputFormat;

    @Option(
            names = {"-f", "--output-file"},
            description = "Output file path (defaults to stdout)"
    )
    private Path outputFile;

    @Option(
            names = {"-c", "--config"},
            description = "Path to configuration YAML file (defaults to " + CONFIG_FILE_NAME + " next to the input)"
    )
    private Path configFile;

    @Option(
            names = {"--nesting-threshold"},
            description = "Report decisions preceded by at least this many decisions (overrides the config file)"
    )
    private Integer nestingThreshold;

    @Option(
            names = {"--rules"},
            description = "Comma-separated ids of the rules to run (default: all enabled rules)",
            split = ","
    )
    private List<String> rules;

    @Option(
            names = {"--fail-on"},
            description = "Exit with code 2 if results at this level or worse exist: error, warning, info",
            defaultValue = "error"
    )
    private String failOnLevel;

    @Option(
            names = {"--no-color"},
            description = "Disable ANSI colors in console output"
    )
    private boolean noColor;

    @Option(
            names = {"-v", "--verbose"},
            description = "Enable verbose output"
    )
    private boolean verbose;

    public enum OutputFormat {
        console,
        json
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new FlowCheckCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        try {
            Severity failLevel = parseSeverity(failOnLevel, "fail-on");
            if (failLevel == null) return 1;

            boolean fromStdin = "-".equals(input);
            Path inputPath = fromStdin ? null : Path.of(input);
            if (inputPath != null && !Files.isRegularFile(inputPath)) {
                System.err.println("Error: Flowchart file does not exist: " + input);
                return 1;
            }

            // Print banner (only for console, not json)
            if (outputFormat != OutputFormat.json) {
                printBanner();
            }

            AnalysisConfig config = loadConfig(inputPath);
            if (nestingThreshold != null) {
                config = config.withNestingThreshold(nestingThreshold);
            }

            // Step 1: Read flowchart
            log("Reading flowchart from " + (fromStdin ? "stdin" : inputPath) + "...");
            FlowchartLoader loader = new FlowchartLoader();
            Flowchart flowchart = fromStdin ? loader.load(System.in) : loader.load(inputPath);
            log("  " + flowchart.nodes().size() + " symbols, " + flowchart.edges().size() + " connectors");

            // Step 2: Analyze
            log("Running analysis rules...");
            FlowchartAnalyzer analyzer = new FlowchartAnalyzer(config);
            if (rules != null && !rules.isEmpty()) {
                Set<String> selected = new LinkedHashSet<>();
                rules.stream().map(String::trim).filter(r -> !r.isEmpty()).forEach(selected::add);
                analyzer = analyzer.withRules(selected);
                log("  Selected rules: " + String.join(", ", selected));
            }
            String sourceName = fromStdin ? "stdin" : inputPath.getFileName().toString();
            AnalysisReport report = analyzer.analyze(flowchart, sourceName);
            log("  Found " + report.totalResults() + " results in " + report.analysisDurationMs() + " ms");

            // Step 3: Output report
            writeReport(report, createReporter());

            // Determine exit code
            if (report.hasResultsAtLeast(failLevel)) {
                if (outputFormat == OutputFormat.console) {
                    System.err.println();
                    System.err.println("Failing due to results at " + failLevel.label() + " level or worse.");
                }
                return 2;
            }

            return 0;

        } catch (InvalidFlowchartException e) {
            System.err.println("Error: Invalid flowchart: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        }
    }

    private AnalysisConfig loadConfig(Path inputPath) throws IOException {
        if (configFile != null) {
            if (!Files.exists(configFile)) {
                throw new IOException("Config file does not exist: " + configFile);
            }
            log("Loading configuration from: " + configFile);
            return AnalysisConfig.load(configFile);
        }

        // Check for flow-check.yaml next to the input file
        if (inputPath != null) {
            Path parent = inputPath.toAbsolutePath().getParent();
            Path localConfig = parent != null ? parent.resolve(CONFIG_FILE_NAME) : null;
            if (localConfig != null && Files.exists(localConfig)) {
                log("Loading configuration from: " + localConfig);
                return AnalysisConfig.load(localConfig);
            }
        }

        return AnalysisConfig.defaults();
    }

    private Reporter createReporter() {
        return switch (outputFormat) {
            case console -> new ConsoleReporter(!noColor);
            case json -> new JsonReporter(true);
        };
    }

    private void writeReport(AnalysisReport report, Reporter reporter) throws IOException {
        if (outputFile != null) {
            reporter.write(report, outputFile);
            if (outputFormat == OutputFormat.console) {
                System.out.println("Report written to: " + outputFile);
            }
        } else {
            // Write to stdout
            reporter.write(report, new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
        }
    }

    private void log(String message) {
        if (verbose && outputFormat != OutputFormat.json) {
            System.out.println(message);
        }
    }

    private Severity parseSeverity(String value, String optionName) {
        try {
            Severity severity = Severity.fromLabel(value);
            if (severity == Severity.SYSTEM_ERROR) {
                throw new IllegalArgumentException("Unsupported level: " + value);
            }
            return severity;
        } catch (IllegalArgumentException e) {
            System.err.println("Error: Invalid value for --" + optionName + ": " + value);
            System.err.println("Valid values: error, warning, info");
            return null;
        }
    }

    private void printBanner() {
        System.out.println("""
                ╔═══════════════════════════════════════════════════════════════╗
                ║                         FLOW-CHECK                            ║
                ║       Structural and Logical Checks for Flowcharts            ║
                ╚═══════════════════════════════════════════════════════════════╝
                """);
    }
}
