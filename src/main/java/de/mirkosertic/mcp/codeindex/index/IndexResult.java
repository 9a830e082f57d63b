package de.mirkosertic.mcp.codeindex.index;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of one index build.
 *
 * @param indexedCount documents written in this build
 * @param skippedCount files left untouched because their fingerprint did not change
 * @param prunedCount  paths removed because they vanished from disk (only in replace mode)
 * @param totalBytes   bytes of all files the walk returned
 * @param warnings     walk warnings, in encounter order
 * @param indexPath    on-disk location of the index
 */
public record IndexResult(
        int indexedCount,
        int skippedCount,
        int prunedCount,
        long totalBytes,
        List<String> warnings,
        Path indexPath
) {

    public IndexResult {
        warnings = List.copyOf(warnings);
    }
}
