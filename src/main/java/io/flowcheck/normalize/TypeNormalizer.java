package io.flowcheck.normalize;

import io.flowcheck.model.NodeType;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Assigns a canonical {@link NodeType} to a drawn node.
 * <p>
 * The decision is a pure function of the node's shape descriptor, its display text and
 * the type hint supplied by the editor. Checks run in a fixed order and the first match wins:
 * <ol>
 *   <li>no style: the hint if it is canonical, otherwise process</li>
 *   <li>text that looks like a call or a signature: subroutine</li>
 *   <li>rhombus / diamond: decision</li>
 *   <li>parallelogram: input or output depending on the text (input when ambiguous)</li>
 *   <li>ellipse: start or end depending on the text, then the hint, then start</li>
 *   <li>rect / rounded / square: process</li>
 *   <li>the hint if it is canonical, otherwise process</li>
 * </ol>
 * Because the subroutine check runs before any shape check, a rhombus labelled
 * {@code check(x)} is a subroutine, not a decision.
 */
public final class TypeNormalizer {

    /**
     * Keywords that mark a node as a subroutine call or definition wherever they appear in the text.
     * Entries with a trailing space must be followed by a separate word.
     */
    public static final List<String> SUBROUTINE_KEYWORDS = List.of(
            "function", "def ", "void ", "int ", "float ", "double ", "string ",
            "subroutine", "procedure", "method", "call ", "invoke"
    );

    private static final List<String> DECISION_SHAPES = List.of("rhombus", "diamond");
    private static final List<String> PROCESS_SHAPES = List.of("rect", "rounded", "square");
    private static final List<String> INPUT_WORDS = List.of("input", "read", "get");
    private static final List<String> OUTPUT_WORDS = List.of("output", "print", "display");
    private static final List<String> END_WORDS = List.of("end", "stop");

    private TypeNormalizer() {
    }

    /**
     * Normalizes a node type.
     *
     * @param style        Shape descriptor (may be null)
     * @param value        Display text (may be null)
     * @param existingType Type hint from the editor (may be null or non-canonical)
     * @return The canonical type, never null
     */
    public static NodeType normalize(String style, String value, String existingType) {
        Optional<NodeType> hint = NodeType.fromLabel(existingType);

        if (style == null || style.isBlank()) {
            return hint.orElse(NodeType.PROCESS);
        }

        String styleLower = style.toLowerCase(Locale.ROOT);
        String valueLower = value != null ? value.toLowerCase(Locale.ROOT) : "";

        if (looksLikeSubroutine(valueLower)) {
            return NodeType.SUBROUTINE;
        }

        if (containsAny(styleLower, DECISION_SHAPES)) {
            return NodeType.DECISION;
        }

        if (styleLower.contains("parallelogram")) {
            if (containsAny(valueLower, INPUT_WORDS)) {
                return NodeType.INPUT;
            }
            if (containsAny(valueLower, OUTPUT_WORDS)) {
                return NodeType.OUTPUT;
            }
            return NodeType.INPUT;
        }

        if (styleLower.contains("ellipse")) {
            if (valueLower.contains("start")) {
                return NodeType.START;
            }
            if (containsAny(valueLower, END_WORDS)) {
                return NodeType.END;
            }
            if (hint.isPresent() && (hint.get() == NodeType.START || hint.get() == NodeType.END)) {
                return hint.get();
            }
            return NodeType.START;
        }

        if (containsAny(styleLower, PROCESS_SHAPES)) {
            return NodeType.PROCESS;
        }

        return hint.orElse(NodeType.PROCESS);
    }

    /**
     * Returns true if the (lower-cased) text contains a subroutine keyword
     * or a parenthesized segment.
     */
    static boolean looksLikeSubroutine(String valueLower) {
        if (valueLower.isEmpty()) {
            return false;
        }
        if (valueLower.contains("(") && valueLower.contains(")")) {
            return true;
        }
        return containsAny(valueLower, SUBROUTINE_KEYWORDS);
    }

    private static boolean containsAny(String text, List<String> needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
