package io.flowcheck.normalize;

import io.flowcheck.model.NodeType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TypeNormalizerTest {

    @Test
    void normalize_withoutStyle_usesCanonicalHint() {
        assertThat(TypeNormalizer.normalize(null, "x > 0?", "decision")).isEqualTo(NodeType.DECISION);
        assertThat(TypeNormalizer.normalize("  ", "Begin", "START")).isEqualTo(NodeType.START);
    }

    @Test
    void normalize_withoutStyle_defaultsToProcess() {
        assertThat(TypeNormalizer.normalize(null, "x = 1", null)).isEqualTo(NodeType.PROCESS);
        assertThat(TypeNormalizer.normalize("", "x = 1", "loop")).isEqualTo(NodeType.PROCESS);
    }

    @Test
    void normalize_parenthesesWinOverShape() {
        assertThat(TypeNormalizer.normalize("rhombus;whiteSpace=wrap;", "check(x)", null))
                .isEqualTo(NodeType.SUBROUTINE);
    }

    @Test
    void normalize_leadingKeywordMeansSubroutine() {
        assertThat(TypeNormalizer.normalize("rounded=1;", "call compute", null)).isEqualTo(NodeType.SUBROUTINE);
        assertThat(TypeNormalizer.normalize("rounded=1;", "  Procedure Sort", null)).isEqualTo(NodeType.SUBROUTINE);
    }

    @Test
    void normalize_keywordInsideTextMeansSubroutine() {
        assertThat(TypeNormalizer.normalize("rounded=0;", "Calculate total using method", null))
                .isEqualTo(NodeType.SUBROUTINE);
        assertThat(TypeNormalizer.normalize("rounded=1;", "then call it", null)).isEqualTo(NodeType.SUBROUTINE);
    }

    @Test
    void normalize_keywordWithoutTrailingWordIsNotSubroutine() {
        assertThat(TypeNormalizer.normalize("rounded=1;", "recall", null)).isEqualTo(NodeType.PROCESS);
        assertThat(TypeNormalizer.normalize("rounded=1;", "Add total", null)).isEqualTo(NodeType.PROCESS);
    }

    @Test
    void normalize_keywordInsideWordWinsOverShape() {
        // "print " contains "int "
        String style = "shape=parallelogram;";
        assertThat(TypeNormalizer.normalize(style, "Print total", null)).isEqualTo(NodeType.SUBROUTINE);
        assertThat(TypeNormalizer.normalize(style, "Print", null)).isEqualTo(NodeType.OUTPUT);
    }

    @Test
    void normalize_rhombusAndDiamondAreDecisions() {
        assertThat(TypeNormalizer.normalize("rhombus;", "x > 0?", null)).isEqualTo(NodeType.DECISION);
        assertThat(TypeNormalizer.normalize("shape=Diamond", "done?", "process")).isEqualTo(NodeType.DECISION);
    }

    @Test
    void normalize_parallelogramUsesTextForDirection() {
        String style = "shape=parallelogram;perimeter=parallelogramPerimeter;";
        assertThat(TypeNormalizer.normalize(style, "Read n", null)).isEqualTo(NodeType.INPUT);
        assertThat(TypeNormalizer.normalize(style, "Output total", null)).isEqualTo(NodeType.OUTPUT);
        assertThat(TypeNormalizer.normalize(style, "Display result", null)).isEqualTo(NodeType.OUTPUT);
        assertThat(TypeNormalizer.normalize(style, "n", "output")).isEqualTo(NodeType.INPUT);
    }

    @Test
    void normalize_ellipseIsStartOrEnd() {
        assertThat(TypeNormalizer.normalize("ellipse;", "Start", null)).isEqualTo(NodeType.START);
        assertThat(TypeNormalizer.normalize("ellipse;", "End", null)).isEqualTo(NodeType.END);
        assertThat(TypeNormalizer.normalize("ellipse;", "STOP", null)).isEqualTo(NodeType.END);
        assertThat(TypeNormalizer.normalize("ellipse;", "", "end")).isEqualTo(NodeType.END);
        assertThat(TypeNormalizer.normalize("ellipse;", "Begin", "process")).isEqualTo(NodeType.START);
    }

    @Test
    void normalize_rectangleIsProcess() {
        assertThat(TypeNormalizer.normalize("rounded=0;whiteSpace=wrap;html=1;", "x = 1", "decision"))
                .isEqualTo(NodeType.PROCESS);
    }

    @Test
    void normalize_unknownShapeFallsBackToHint() {
        assertThat(TypeNormalizer.normalize("text;html=1;", "note", "output")).isEqualTo(NodeType.OUTPUT);
        assertThat(TypeNormalizer.normalize("text;html=1;", "note", null)).isEqualTo(NodeType.PROCESS);
    }

    @Test
    void normalize_isDeterministic() {
        NodeType first = TypeNormalizer.normalize("shape=parallelogram", "get value", "input");
        TypeNormalizer.normalize("ellipse", "End", null);
        NodeType second = TypeNormalizer.normalize("shape=parallelogram", "get value", "input");

        assertThat(second).isEqualTo(first).isEqualTo(NodeType.INPUT);
    }
}
