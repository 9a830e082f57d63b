package de.mirkosertic.mcp.codeindex.search;

import de.mirkosertic.mcp.codeindex.walker.FileEntry;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Fallback without an index: case-insensitive substring match on content or path, in input order.
 */
public class SubstringSearchProvider implements SearchProvider {

    public static final String NAME = "substring";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<FileEntry> filterFiles(final List<FileEntry> files, final String query, final Path root, final int limit) {
        final String needle = query.toLowerCase(Locale.ROOT);
        final List<FileEntry> matched = new ArrayList<>();
        for (final FileEntry file : files) {
            if (matched.size() >= limit) {
                break;
            }
            if (file.content().toLowerCase(Locale.ROOT).contains(needle)
                    || file.path().toLowerCase(Locale.ROOT).contains(needle)) {
                matched.add(file);
            }
        }
        return matched;
    }
}
