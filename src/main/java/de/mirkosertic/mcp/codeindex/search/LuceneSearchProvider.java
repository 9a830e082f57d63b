package de.mirkosertic.mcp.codeindex.search;

import de.mirkosertic.mcp.codeindex.error.CodeIndexException;
import de.mirkosertic.mcp.codeindex.index.IndexServiceCache;
import de.mirkosertic.mcp.codeindex.index.SearchResult;
import de.mirkosertic.mcp.codeindex.walker.FileEntry;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Orders files by their rank in the root's Lucene index. Files that are not in the index,
 * or did not match, are dropped. Repeated hits for the same path count once.
 */
public class LuceneSearchProvider implements SearchProvider {

    public static final String NAME = "lucene";

    private final IndexServiceCache indexServiceCache;

    public LuceneSearchProvider(final IndexServiceCache indexServiceCache) {
        this.indexServiceCache = indexServiceCache;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean requiresIndex() {
        return true;
    }

    @Override
    public List<FileEntry> filterFiles(final List<FileEntry> files, final String query, final Path root, final int limit)
            throws CodeIndexException, IOException {
        final List<SearchResult> results = indexServiceCache.get(root).search(query, limit, null);

        final Map<String, FileEntry> byPath = new HashMap<>();
        for (final FileEntry file : files) {
            byPath.put(file.path(), file);
        }

        final List<FileEntry> ordered = new ArrayList<>();
        for (final SearchResult result : results) {
            final FileEntry file = byPath.remove(result.path());
            if (file != null) {
                ordered.add(file);
            }
        }
        return ordered;
    }
}
