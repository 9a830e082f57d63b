package de.mirkosertic.mcp.codeindex.error;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Malformed or inaccessible filesystem input, e.g. a missing walk root or a
 * binary file encountered under the {@code error} binary policy.
 */
public class InputException extends CodeIndexException {

    public InputException(final String message, final @Nullable String why, final @Nullable String fix) {
        this(message, why, fix, List.of());
    }

    public InputException(final String message, final @Nullable String why, final @Nullable String fix,
                          final List<String> trySteps) {
        super(message, why, fix, trySteps, null);
    }

    @Override
    public String errorType() {
        return "input_error";
    }
}
