package io.flowcheck.normalize;

import io.flowcheck.model.SubroutineInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class SubroutineInfoParserTest {

    private SubroutineInfoParser parser;

    @BeforeEach
    void setUp() {
        parser = new SubroutineInfoParser();
    }

    @Test
    void parse_keywordSignature() {
        SubroutineInfo info = parser.parse("function area(w, h)");

        assertThat(info.functionName()).isEqualTo("area");
        assertThat(info.parameters()).containsExactly("w", "h");
        assertThat(info.signature()).isEqualTo("area(w, h)");
    }

    @Test
    void parse_keywordSignatureWithoutParameters() {
        SubroutineInfo info = parser.parse("def greet()");

        assertThat(info.functionName()).isEqualTo("greet");
        assertThat(info.parameters()).isEmpty();
    }

    @Test
    void parse_bareSignature() {
        SubroutineInfo info = parser.parse("  compute(a,b , c) ");

        assertThat(info.functionName()).isEqualTo("compute");
        assertThat(info.parameters()).containsExactly("a", "b", "c");
    }

    @Test
    void parse_callStatement() {
        assertThat(parser.parse("call compute").functionName()).isEqualTo("compute");
        assertThat(parser.parse("Invoke Helper").functionName()).isEqualTo("Helper");
    }

    @Test
    void parse_singleIdentifier() {
        SubroutineInfo info = parser.parse("validate_input");

        assertThat(info.functionName()).isEqualTo("validate_input");
        assertThat(info.parameters()).isEmpty();
    }

    @Test
    void parse_unrecognizedTextIsEmpty() {
        assertThat(parser.parse("do the thing").isEmpty()).isTrue();
        assertThat(parser.parse(null).isEmpty()).isTrue();
        assertThat(parser.parse("   ").name()).isEmpty();
    }

    @Test
    void parse_stopsAtFirstMatchingStrategy() {
        SubroutineInfoParser custom = new SubroutineInfoParser(List.of(
                SignatureMatcher.regex("first-word", Pattern.compile("(\\w+)"), false),
                SignatureMatcher.regex("never", Pattern.compile("(zzz)"), false)
        ));

        assertThat(custom.parse("foo bar").functionName()).isEqualTo("foo");
        assertThat(custom.matchers()).extracting(SignatureMatcher::name).containsExactly("first-word", "never");
    }
}
