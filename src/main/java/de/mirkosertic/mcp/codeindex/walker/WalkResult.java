package de.mirkosertic.mcp.codeindex.walker;

import java.util.List;

/**
 * Outcome of one {@link DirectoryWalker#collect} call.
 *
 * @param files      files sorted by relative POSIX path
 * @param warnings   per-file problems that did not abort the walk
 * @param truncated  {@code true} if the total byte budget stopped the walk early
 * @param totalBytes sum of the sizes of all returned files
 */
public record WalkResult(List<FileEntry> files, List<String> warnings, boolean truncated, long totalBytes) {

    public WalkResult {
        files = List.copyOf(files);
        warnings = List.copyOf(warnings);
    }
}
