package io.flowcheck.report;

import io.flowcheck.model.AnalysisResult;
import io.flowcheck.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns analysis results into friendly, actionable messages for students.
 * <p>
 * Results are grouped as start issues, end issues, connection issues and everything else,
 * in that order. Editor HTML is stripped from any symbol text that is quoted back.
 */
public class FeedbackFormatter {

    public static final String ALL_GOOD =
            "✅ Great! Your flowchart structure looks good and follows all the basic rules.";

    private static final String ERROR_ICON = "❌";
    private static final String WARNING_ICON = "⚠️";
    private static final String INFO_ICON = "ℹ️";

    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern SYMBOL_TEXT = Pattern.compile("Symbol '([^']+)'");
    private static final Pattern COUNT = Pattern.compile("but (\\S+) were");
    private static final Pattern PARENTHESIZED = Pattern.compile("\\s*\\([^)]*\\)\\s*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Formats the given results. Returns the single "looks good" message for an empty list.
     */
    public List<String> format(List<AnalysisResult> results) {
        List<String> feedback = new ArrayList<>();
        if (results == null || results.isEmpty()) {
            feedback.add(ALL_GOOD);
            return feedback;
        }

        List<AnalysisResult> startIssues = new ArrayList<>();
        List<AnalysisResult> endIssues = new ArrayList<>();
        List<AnalysisResult> connectionIssues = new ArrayList<>();
        List<AnalysisResult> otherIssues = new ArrayList<>();

        for (AnalysisResult result : results) {
            String ruleId = result.ruleId();
            if (ruleId.contains("START")) {
                startIssues.add(result);
            } else if (ruleId.contains("END")) {
                endIssues.add(result);
            } else if (ruleId.contains("UNCONNECTED") || ruleId.contains("OUTGOING") || ruleId.contains("INCOMING")) {
                connectionIssues.add(result);
            } else {
                otherIssues.add(result);
            }
        }

        startIssues.forEach(r -> startFeedback(r, feedback));
        endIssues.forEach(r -> endFeedback(r, feedback));
        connectionIssues.forEach(r -> connectionFeedback(r, feedback));
        otherIssues.forEach(r -> feedback.add(otherFeedback(r)));
        return feedback;
    }

    private void startFeedback(AnalysisResult result, List<String> feedback) {
        switch (result.ruleId()) {
            case "NO_START_SYMBOL" -> feedback.add(ERROR_ICON + " **Missing Start Symbol**: Your flowchart needs "
                    + "exactly one 'Start' symbol to show where the program begins. Please add a start symbol "
                    + "(usually an oval or rounded rectangle).");
            case "MULTIPLE_START_SYMBOLS" -> {
                Matcher m = COUNT.matcher(result.message());
                String count = m.find() ? m.group(1) : "multiple";
                feedback.add(ERROR_ICON + " **Too Many Start Symbols**: Your flowchart has " + count
                        + " start symbols, but it should have exactly one. Please remove the extra start symbols "
                        + "so there's only one entry point.");
            }
            case "START_SYMBOL_NO_OUTGOING" -> feedback.add(WARNING_ICON + " **Disconnected Start**: Your start "
                    + "symbol isn't connected to anything. Please draw an arrow from the start symbol to the first "
                    + "step of your process.");
            default -> feedback.add(otherFeedback(result));
        }
    }

    private void endFeedback(AnalysisResult result, List<String> feedback) {
        switch (result.ruleId()) {
            case "NO_END_SYMBOL" -> feedback.add(ERROR_ICON + " **Missing End Symbol**: Your flowchart needs at "
                    + "least one 'End' symbol to show where the program finishes. Please add an end symbol "
                    + "(usually an oval or rounded rectangle).");
            case "END_SYMBOL_NO_INCOMING" -> feedback.add(WARNING_ICON + " **Disconnected End**: Your end symbol "
                    + "isn't connected to anything. Please draw an arrow from your last process step to the end "
                    + "symbol.");
            default -> feedback.add(otherFeedback(result));
        }
    }

    private void connectionFeedback(AnalysisResult result, List<String> feedback) {
        Matcher m = SYMBOL_TEXT.matcher(result.message());
        if (!m.find()) {
            feedback.add(WARNING_ICON + " **Connection Issue**: Some elements in your flowchart are not properly "
                    + "connected. Please check that all elements have appropriate arrows showing the flow.");
            return;
        }

        String raw = m.group(1);
        String clean = cleanHtml(raw);
        // Only quote the text back when the editor wrapped it in markup
        boolean quote = !clean.isEmpty() && !clean.equals(raw);

        switch (result.ruleId()) {
            case "UNCONNECTED_SYMBOL_BOTH" -> feedback.add(WARNING_ICON + " **Floating Element**: "
                    + (quote ? "The element containing \"" + clean + "\" is not connected to your flowchart."
                             : "There's an element that's not connected to your flowchart.")
                    + " Please connect it with arrows to show the flow of your program.");
            case "UNCONNECTED_SYMBOL_NO_INCOMING" -> feedback.add(WARNING_ICON + " **Missing Input Connection**: "
                    + (quote ? "The element \"" + clean + "\" has no incoming arrows."
                             : "There's an element with no incoming arrows.")
                    + " Please connect it to the previous step in your process.");
            case "UNCONNECTED_SYMBOL_NO_OUTGOING" -> feedback.add(WARNING_ICON + " **Missing Output Connection**: "
                    + (quote ? "The element \"" + clean + "\" has no outgoing arrows."
                             : "There's an element with no outgoing arrows.")
                    + " Please connect it to the next step in your process or to an end symbol.");
            default -> {
                // other rule ids in this group carry no specific advice
            }
        }
    }

    private String otherFeedback(AnalysisResult result) {
        String message = PARENTHESIZED.matcher(result.message()).replaceAll(" ");
        message = WHITESPACE.matcher(message).replaceAll(" ").trim();
        return icon(result.severity()) + " " + message;
    }

    private static String icon(Severity severity) {
        return switch (severity) {
            case ERROR -> ERROR_ICON;
            case WARNING -> WARNING_ICON;
            default -> INFO_ICON;
        };
    }

    /**
     * Removes HTML tags and decodes the common entities the editor produces.
     */
    public static String cleanHtml(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String clean = HTML_TAG.matcher(text).replaceAll("");
        clean = clean.replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&amp;", "&")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&nbsp;", " ");
        return clean.strip();
    }
}
