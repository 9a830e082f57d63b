package de.mirkosertic.mcp.codeindex.mcp.dto;

import de.mirkosertic.mcp.codeindex.index.SearchResult;

/**
 * One hit as returned by the search tool.
 */
public record SearchHit(
        String path,
        float score,
        String language,
        String docId,
        String sha256,
        long bytesSize
) {
    public static SearchHit from(final SearchResult result) {
        return new SearchHit(result.path(), result.score(), result.language(), result.docId(), result.sha256(),
                result.bytesSize());
    }
}
