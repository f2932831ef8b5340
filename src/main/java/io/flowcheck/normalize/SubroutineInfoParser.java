package io.flowcheck.normalize;

import io.flowcheck.model.SubroutineInfo;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Extracts the function name and parameter list from the text of a subroutine node.
 * <p>
 * Patterns are tried in this order, first success wins:
 * <ol>
 *   <li>{@code <keyword> name(a, b)}, e.g. "function area(w, h)"</li>
 *   <li>{@code name(a, b)}</li>
 *   <li>{@code call name} / {@code invoke name}</li>
 *   <li>the whole text is a single identifier</li>
 * </ol>
 * Anything else yields {@link SubroutineInfo#empty()}.
 */
public class SubroutineInfoParser {

    private static final String IDENTIFIER = "([A-Za-z_][A-Za-z0-9_]*)";

    private static final String KEYWORD_ALTERNATION = TypeNormalizer.SUBROUTINE_KEYWORDS.stream()
            .map(String::trim)
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));

    private static final List<SignatureMatcher> DEFAULT_MATCHERS = List.of(
            SignatureMatcher.regex("keyword-signature",
                    Pattern.compile("\\b(?:" + KEYWORD_ALTERNATION + ")\\s+" + IDENTIFIER + "\\s*\\(([^)]*)\\)",
                            Pattern.CASE_INSENSITIVE),
                    false),
            SignatureMatcher.regex("bare-signature",
                    Pattern.compile(IDENTIFIER + "\\s*\\(([^)]*)\\)"),
                    false),
            SignatureMatcher.regex("call-statement",
                    Pattern.compile("\\b(?:call|invoke)\\s+" + IDENTIFIER, Pattern.CASE_INSENSITIVE),
                    false),
            SignatureMatcher.regex("identifier",
                    Pattern.compile(IDENTIFIER),
                    true)
    );

    private final List<SignatureMatcher> matchers;

    public SubroutineInfoParser() {
        this(DEFAULT_MATCHERS);
    }

    public SubroutineInfoParser(List<SignatureMatcher> matchers) {
        this.matchers = List.copyOf(matchers);
    }

    /**
     * Parses the given node text.
     *
     * @param value Display text, may be null
     * @return Parsed info, never null
     */
    public SubroutineInfo parse(String value) {
        if (value == null || value.isBlank()) {
            return SubroutineInfo.empty();
        }
        String text = value.trim();
        for (SignatureMatcher matcher : matchers) {
            Optional<SubroutineInfo> info = matcher.match(text);
            if (info.isPresent()) {
                return info.get();
            }
        }
        return SubroutineInfo.empty();
    }

    public List<SignatureMatcher> matchers() {
        return matchers;
    }
}
