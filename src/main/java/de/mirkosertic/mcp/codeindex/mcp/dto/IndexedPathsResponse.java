package de.mirkosertic.mcp.codeindex.mcp.dto;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for the listIndexedPaths tool. Paths are sorted.
 */
public record IndexedPathsResponse(
        boolean success,
        String root,
        List<String> paths,
        Integer count,
        Map<String, Object> error
) {
    public static IndexedPathsResponse success(final String root, final List<String> paths) {
        return new IndexedPathsResponse(true, root, paths, paths.size(), null);
    }

    public static IndexedPathsResponse error(final Map<String, Object> error) {
        return new IndexedPathsResponse(false, null, null, null, error);
    }
}
