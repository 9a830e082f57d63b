package de.mirkosertic.mcp.codeindex.mcp.dto;

import de.mirkosertic.mcp.codeindex.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the search tool.
 */
public record SearchRequest(
        @Description("Absolute path of the indexed directory.")
        String root,

        @Description("Query in Lucene syntax, matched against file path, file name stem and content.")
        String query,

        @Nullable
        @Description("Maximum number of hits. Defaults to the configured limit, maximum is 200.")
        Integer limit,

        @Nullable
        @Description("Only return hits of this language, e.g. 'python' or 'markdown'. Applied after the limit.")
        String language
) {
    static final int MAX_LIMIT = 200;

    public static SearchRequest fromMap(final Map<String, Object> args) {
        return new SearchRequest(
                (String) args.get("root"),
                (String) args.get("query"),
                args.get("limit") != null ? ((Number) args.get("limit")).intValue() : null,
                (String) args.get("language")
        );
    }

    public int effectiveLimit(final int defaultLimit) {
        return (limit != null && limit > 0) ? Math.min(limit, MAX_LIMIT) : defaultLimit;
    }
}
