package de.mirkosertic.mcp.codeindex.walker;

/**
 * A readable text file found by the {@link DirectoryWalker}.
 *
 * @param path    POSIX style path relative to the walk root, unique within one walk
 * @param size    size on disk in bytes
 * @param content decoded text content
 */
public record FileEntry(String path, long size, String content) {

    /**
     * File name without the last extension, e.g. {@code main} for {@code src/main.py}.
     * Names that start with their only dot (such as {@code .bashrc}) are returned unchanged.
     */
    public String stem() {
        final String name = fileName();
        final int lastDot = name.lastIndexOf('.');
        if (lastDot <= 0) {
            return name;
        }
        return name.substring(0, lastDot);
    }

    public String fileName() {
        final int lastSlash = path.lastIndexOf('/');
        return lastSlash >= 0 ? path.substring(lastSlash + 1) : path;
    }
}
