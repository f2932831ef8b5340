package io.flowcheck.model;

import java.util.List;
import java.util.Optional;

/**
 * Function name and parameters parsed from a subroutine node's text.
 *
 * @param functionName Parsed identifier, or null when nothing could be parsed
 * @param parameters   Parameters in declaration order
 */
public record SubroutineInfo(
        String functionName,
        List<String> parameters
) {
    private static final SubroutineInfo EMPTY = new SubroutineInfo(null, List.of());

    public SubroutineInfo {
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
    }

    public static SubroutineInfo empty() {
        return EMPTY;
    }

    public static SubroutineInfo of(String functionName, List<String> parameters) {
        return new SubroutineInfo(functionName, parameters);
    }

    public Optional<String> name() {
        return Optional.ofNullable(functionName);
    }

    public boolean isEmpty() {
        return functionName == null;
    }

    /**
     * Formats as a call signature, e.g. "area(w, h)".
     */
    public String signature() {
        if (functionName == null) {
            return "";
        }
        return functionName + "(" + String.join(", ", parameters) + ")";
    }
}
