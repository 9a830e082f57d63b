package de.mirkosertic.mcp.codeindex.index;

import java.util.Locale;
import java.util.Map;

/**
 * Derives the language tag stored with every document from its file extension.
 */
public final class Languages {

    static final String NO_EXTENSION = "text";

    private static final Map<String, String> BY_EXTENSION = Map.ofEntries(
            Map.entry("py", "python"),
            Map.entry("js", "javascript"),
            Map.entry("jsx", "javascript"),
            Map.entry("ts", "typescript"),
            Map.entry("tsx", "typescript"),
            Map.entry("json", "json"),
            Map.entry("yml", "yaml"),
            Map.entry("yaml", "yaml"),
            Map.entry("toml", "toml"),
            Map.entry("md", "markdown"),
            Map.entry("rst", "rst"),
            Map.entry("go", "go"),
            Map.entry("rs", "rust"),
            Map.entry("java", "java"),
            Map.entry("c", "c"),
            Map.entry("cpp", "cpp"),
            Map.entry("h", "c")
    );

    private Languages() {
    }

    /**
     * @param path POSIX style relative path
     * @return the mapped language, {@code text} for files without extension, otherwise the
     * lowercase extension itself
     */
    public static String fromPath(final String path) {
        final int lastSlash = path.lastIndexOf('/');
        final String fileName = lastSlash >= 0 ? path.substring(lastSlash + 1) : path;
        final int lastDot = fileName.lastIndexOf('.');
        if (lastDot <= 0 || lastDot == fileName.length() - 1) {
            return NO_EXTENSION;
        }
        final String extension = fileName.substring(lastDot + 1).toLowerCase(Locale.ROOT);
        return BY_EXTENSION.getOrDefault(extension, extension);
    }
}
