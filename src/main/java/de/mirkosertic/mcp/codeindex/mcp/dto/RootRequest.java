package de.mirkosertic.mcp.codeindex.mcp.dto;

import de.mirkosertic.mcp.codeindex.mcp.Description;

import java.util.Map;

/**
 * Request DTO for tools that only need the indexed root.
 */
public record RootRequest(
        @Description("Absolute path of the indexed directory.")
        String root
) {
    public static RootRequest fromMap(final Map<String, Object> args) {
        return new RootRequest((String) args.get("root"));
    }
}
