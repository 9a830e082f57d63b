package de.mirkosertic.mcp.codeindex.walker;

import de.mirkosertic.mcp.codeindex.error.InputException;

import java.util.Locale;

/**
 * What the walker does when it meets a file that looks binary.
 */
public enum BinaryPolicy {
    /** Omit the file and record a warning. */
    SKIP,
    /** Abort the whole walk with an {@link InputException}. */
    ERROR;

    public static BinaryPolicy parse(final String value) throws InputException {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            throw new InputException("Unknown binary policy.",
                    "'" + value + "' is not one of 'skip' or 'error'.",
                    "Use binary-policy 'skip' or 'error'.");
        }
    }
}
