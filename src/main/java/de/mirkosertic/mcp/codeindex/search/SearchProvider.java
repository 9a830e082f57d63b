package de.mirkosertic.mcp.codeindex.search;

import de.mirkosertic.mcp.codeindex.error.CodeIndexException;
import de.mirkosertic.mcp.codeindex.walker.FileEntry;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Narrows an already collected file set down to the files relevant for a query.
 */
public interface SearchProvider {

    /**
     * Name reported in index stats and logs, e.g. {@code lucene}.
     */
    String name();

    /**
     * @return {@code true} if {@link #filterFiles} reads the root's index, which then has to be
     * brought up to date first
     */
    default boolean requiresIndex() {
        return false;
    }

    /**
     * @param files files collected from {@code root}
     * @param query free text query
     * @param root  directory the files were collected from
     * @param limit maximum number of files to return
     * @return a subset of {@code files}, most relevant first
     */
    List<FileEntry> filterFiles(List<FileEntry> files, String query, Path root, int limit)
            throws CodeIndexException, IOException;
}
