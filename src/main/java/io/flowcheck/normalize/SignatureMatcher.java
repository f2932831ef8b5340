package io.flowcheck.normalize;

import io.flowcheck.model.SubroutineInfo;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One strategy for extracting a function name and parameters from node text.
 * {@link SubroutineInfoParser} tries its matchers in order and stops at the first hit.
 */
public interface SignatureMatcher {

    /**
     * Short name for diagnostics.
     */
    String name();

    /**
     * Tries to extract subroutine info from trimmed text.
     *
     * @return the parsed info, or empty if this strategy does not apply
     */
    Optional<SubroutineInfo> match(String text);

    /**
     * Creates a matcher backed by a regular expression.
     * Group 1 must capture the identifier; group 2, if present, the raw parameter list.
     *
     * @param name     Strategy name
     * @param pattern  Compiled pattern
     * @param anchored true to require the whole text to match, false to search within it
     */
    static SignatureMatcher regex(String name, Pattern pattern, boolean anchored) {
        return new RegexSignatureMatcher(name, pattern, anchored);
    }

    /**
     * Splits a raw parameter list on commas, trimming and dropping empty segments.
     */
    static List<String> splitParameters(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .toList();
    }

    /**
     * Regex-backed matcher.
     */
    record RegexSignatureMatcher(String name, Pattern pattern, boolean anchored) implements SignatureMatcher {

        @Override
        public Optional<SubroutineInfo> match(String text) {
            Matcher m = pattern.matcher(text);
            boolean found = anchored ? m.matches() : m.find();
            if (!found) {
                return Optional.empty();
            }
            String params = m.groupCount() >= 2 ? m.group(2) : null;
            return Optional.of(SubroutineInfo.of(m.group(1), splitParameters(params)));
        }
    }
}
