package de.mirkosertic.mcp.codeindex.mcp.dto;

import java.util.Map;

/**
 * Response DTO for the clearIndex tool.
 *
 * @param existed whether there was an index to delete
 */
public record ClearIndexResponse(
        boolean success,
        String root,
        String indexPath,
        Boolean existed,
        Map<String, Object> error
) {

    public static ClearIndexResponse success(final String root, final String indexPath, final boolean existed) {
        return new ClearIndexResponse(true, root, indexPath, existed, null);
    }

    public static ClearIndexResponse error(final Map<String, Object> error) {
        return new ClearIndexResponse(false, null, null, null, error);
    }
}
