package de.mirkosertic.mcp.codeindex.mcp.dto;

import de.mirkosertic.mcp.codeindex.mcp.Description;
import de.mirkosertic.mcp.codeindex.walker.WalkOptions;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for the indexDirectory tool. Unset options fall back to the configured walk defaults.
 */
public record IndexDirectoryRequest(
        @Description("Absolute path of the directory to index.")
        String root,

        @Nullable
        @Description("Delete the existing index and rebuild from scratch. Default is false.")
        Boolean force,

        @Nullable
        @Description("File extensions to index, e.g. ['.py', '.md']. Defaults to common source and text types.")
        List<String> extensions,

        @Nullable
        @Description("Gitignore-style globs a file must match to be indexed.")
        List<String> includeGlobs,

        @Nullable
        @Description("Gitignore-style globs of files to skip.")
        List<String> excludeGlobs,

        @Nullable
        @Description("Honour the root level .gitignore. Default is true.")
        Boolean respectGitignore,

        @Nullable
        @Description("Index dot files and dot directories. Default is false.")
        Boolean includeHidden,

        @Nullable
        @Description("Skip files larger than this many bytes.")
        Long maxFileBytes,

        @Nullable
        @Description("Stop the walk once this many bytes were collected.")
        Long maxTotalBytes
) {

    public static IndexDirectoryRequest fromMap(final Map<String, Object> args) {
        return new IndexDirectoryRequest(
                (String) args.get("root"),
                (Boolean) args.get("force"),
                stringList(args.get("extensions")),
                stringList(args.get("includeGlobs")),
                stringList(args.get("excludeGlobs")),
                (Boolean) args.get("respectGitignore"),
                (Boolean) args.get("includeHidden"),
                args.get("maxFileBytes") != null ? ((Number) args.get("maxFileBytes")).longValue() : null,
                args.get("maxTotalBytes") != null ? ((Number) args.get("maxTotalBytes")).longValue() : null
        );
    }

    static @Nullable List<String> stringList(final @Nullable Object value) {
        if (!(value instanceof List<?> raw)) {
            return null;
        }
        final List<String> result = new ArrayList<>(raw.size());
        for (final Object item : raw) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }

    public boolean isForce() {
        return force != null && force;
    }

    /**
     * Overlays the options given in this request on {@code defaults}.
     */
    public WalkOptions toWalkOptions(final WalkOptions defaults) {
        final WalkOptions.Builder builder = defaults.toBuilder();
        if (extensions != null) {
            builder.extensions(extensions);
        }
        if (includeGlobs != null) {
            builder.includeGlobs(includeGlobs);
        }
        if (excludeGlobs != null) {
            builder.excludeGlobs(excludeGlobs);
        }
        if (respectGitignore != null) {
            builder.respectGitignore(respectGitignore);
        }
        if (includeHidden != null) {
            builder.includeHidden(includeHidden);
        }
        if (maxFileBytes != null) {
            builder.maxFileBytes(maxFileBytes);
        }
        if (maxTotalBytes != null) {
            builder.maxTotalBytes(maxTotalBytes);
        }
        return builder.build();
    }
}
