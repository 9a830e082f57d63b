package de.mirkosertic.mcp.codeindex.mcp.dto;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for the search tool. Hits are ordered best first.
 */
public record SearchResponse(
        boolean success,
        List<SearchHit> hits,
        Integer hitCount,
        Long searchTimeMs,
        Map<String, Object> error
) {
    public static SearchResponse success(final List<SearchHit> hits, final long searchTimeMs) {
        return new SearchResponse(true, hits, hits.size(), searchTimeMs, null);
    }

    public static SearchResponse error(final Map<String, Object> error) {
        return new SearchResponse(false, null, null, null, error);
    }
}
