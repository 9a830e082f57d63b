package de.mirkosertic.mcp.codeindex.mcp.dto;

import java.util.Map;

/**
 * Response DTO for the getIndexStats tool.
 */
public record IndexStatsResponse(
        boolean success,
        String root,
        String indexPath,
        Long documentCount,
        Integer indexedPathCount,
        Integer schemaVersion,
        Boolean locked,
        String searchProvider,
        String softwareVersion,
        String buildTimestamp,
        Map<String, Object> error
) {
    public static IndexStatsResponse success(final String root, final String indexPath, final long documentCount,
                                             final int indexedPathCount, final int schemaVersion, final boolean locked,
                                             final String searchProvider, final String softwareVersion,
                                             final String buildTimestamp) {
        return new IndexStatsResponse(true, root, indexPath, documentCount, indexedPathCount, schemaVersion, locked,
                searchProvider, softwareVersion, buildTimestamp, null);
    }

    public static IndexStatsResponse error(final Map<String, Object> error) {
        return new IndexStatsResponse(false, null, null, null, null, null, null, null, null, null, error);
    }
}
