package de.mirkosertic.mcp.codeindex.mcp.dto;

import de.mirkosertic.mcp.codeindex.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the findFiles tool.
 */
public record FindFilesRequest(
        @Description("Absolute path of the directory to select files from.")
        String root,

        @Description("Free text query used to pick the most relevant files.")
        String query,

        @Nullable
        @Description("Maximum number of files. Default is 50.")
        Integer limit
) {
    static final int DEFAULT_LIMIT = 50;

    public static FindFilesRequest fromMap(final Map<String, Object> args) {
        return new FindFilesRequest(
                (String) args.get("root"),
                (String) args.get("query"),
                args.get("limit") != null ? ((Number) args.get("limit")).intValue() : null
        );
    }

    public int effectiveLimit() {
        return (limit != null && limit > 0) ? limit : DEFAULT_LIMIT;
    }
}
