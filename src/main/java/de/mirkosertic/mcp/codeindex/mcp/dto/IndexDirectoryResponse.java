package de.mirkosertic.mcp.codeindex.mcp.dto;

import de.mirkosertic.mcp.codeindex.index.IndexResult;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for the indexDirectory tool.
 */
public record IndexDirectoryResponse(
        boolean success,
        Integer indexedCount,
        Integer skippedCount,
        Integer prunedCount,
        Long totalBytes,
        List<String> warnings,
        String indexPath,
        Long durationMs,
        Map<String, Object> error
) {
    public static IndexDirectoryResponse success(final IndexResult result, final long durationMs) {
        return new IndexDirectoryResponse(true, result.indexedCount(), result.skippedCount(), result.prunedCount(),
                result.totalBytes(), result.warnings(), result.indexPath().toString(), durationMs, null);
    }

    public static IndexDirectoryResponse error(final Map<String, Object> error) {
        return new IndexDirectoryResponse(false, null, null, null, null, null, null, null, error);
    }
}
