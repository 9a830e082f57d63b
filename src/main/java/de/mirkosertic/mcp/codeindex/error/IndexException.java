package de.mirkosertic.mcp.codeindex.error;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Index level failure: the index for a root does not exist yet, it is locked by
 * another writer, or no search provider is available.
 */
public class IndexException extends CodeIndexException {

    public IndexException(final String message, final @Nullable String why, final @Nullable String fix) {
        this(message, why, fix, List.of(), null);
    }

    public IndexException(final String message, final @Nullable String why, final @Nullable String fix,
                          final List<String> trySteps, final @Nullable Throwable cause) {
        super(message, why, fix, trySteps, cause);
    }

    @Override
    public String errorType() {
        return "index_error";
    }
}
