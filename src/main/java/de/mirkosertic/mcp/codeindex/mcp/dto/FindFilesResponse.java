package de.mirkosertic.mcp.codeindex.mcp.dto;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for the findFiles tool.
 */
public record FindFilesResponse(
        boolean success,
        String provider,
        List<FoundFile> files,
        List<String> warnings,
        Map<String, Object> error
) {
    public record FoundFile(String path, long bytesSize) {
    }

    public static FindFilesResponse success(final String provider, final List<FoundFile> files, final List<String> warnings) {
        return new FindFilesResponse(true, provider, files, warnings, null);
    }

    public static FindFilesResponse error(final Map<String, Object> error) {
        return new FindFilesResponse(false, null, null, null, error);
    }
}
