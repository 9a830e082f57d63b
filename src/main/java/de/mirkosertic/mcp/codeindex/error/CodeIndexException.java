package de.mirkosertic.mcp.codeindex.error;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class for user-facing failures of the indexing core.
 * <p>
 * Every instance carries a short message plus an optional reason ({@code why}),
 * an optional remediation ({@code fix}) and concrete next steps to try. The
 * tool layer renders these either as text or as a JSON error payload.
 */
public abstract class CodeIndexException extends Exception {

    private final @Nullable String why;
    private final @Nullable String fix;
    private final List<String> trySteps;

    protected CodeIndexException(final String message, final @Nullable String why,
                                 final @Nullable String fix, final List<String> trySteps,
                                 final @Nullable Throwable cause) {
        super(message, cause);
        this.why = why;
        this.fix = fix;
        this.trySteps = List.copyOf(trySteps);
    }

    /**
     * Machine readable error kind, e.g. {@code input_error}.
     */
    public abstract String errorType();

    public @Nullable String getWhy() {
        return why;
    }

    public @Nullable String getFix() {
        return fix;
    }

    public List<String> getTrySteps() {
        return trySteps;
    }

    /**
     * Render the error as a multi-line human readable message.
     */
    public String toText() {
        final List<String> lines = new ArrayList<>();
        lines.add("Error: " + getMessage());
        if (why != null) {
            lines.add("Why: " + why);
        }
        if (fix != null) {
            lines.add("How to fix: " + fix);
        }
        if (!trySteps.isEmpty()) {
            lines.add("Try:");
            for (final String step : trySteps) {
                lines.add("- " + step);
            }
        }
        return String.join("\n", lines);
    }

    /**
     * Render the error as a JSON-friendly map with {@code type}, {@code message},
     * {@code hint} and {@code try} keys. The hint prefers the fix over the reason.
     */
    public Map<String, Object> toMap() {
        final Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", errorType());
        payload.put("message", getMessage());
        final String hint = fix != null ? fix : why;
        if (hint != null) {
            payload.put("hint", hint);
        }
        if (!trySteps.isEmpty()) {
            payload.put("try", trySteps);
        }
        return payload;
    }
}
