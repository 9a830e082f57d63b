package de.mirkosertic.mcp.codeindex.search;

import de.mirkosertic.mcp.codeindex.error.IndexException;
import de.mirkosertic.mcp.codeindex.index.IndexServiceCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Picks the search provider once at startup.
 */
public final class SearchProviders {

    private static final Logger logger = LoggerFactory.getLogger(SearchProviders.class);

    public static final String AUTO = "auto";
    static final String LUCENE_PROBE_CLASS = "org.apache.lucene.index.IndexWriter";

    private SearchProviders() {
    }

    /**
     * @param configured {@code auto}, {@code lucene} or {@code substring}
     */
    public static SearchProvider select(final String configured, final IndexServiceCache indexServiceCache)
            throws IndexException {
        return select(configured, indexServiceCache, isAvailable(LUCENE_PROBE_CLASS));
    }

    static SearchProvider select(final String configured, final IndexServiceCache indexServiceCache,
                                 final boolean luceneAvailable) throws IndexException {
        final String name = configured == null ? AUTO : configured.trim().toLowerCase(Locale.ROOT);
        switch (name) {
            case AUTO:
                if (luceneAvailable) {
                    return new LuceneSearchProvider(indexServiceCache);
                }
                logger.warn("Lucene is not on the classpath, falling back to substring search");
                return new SubstringSearchProvider();
            case LuceneSearchProvider.NAME:
                if (!luceneAvailable) {
                    throw new IndexException(
                            "Lucene search is not available.",
                            "The Lucene classes could not be loaded.",
                            "Use the packaged server jar or set codeindex.search.provider to 'substring'.",
                            List.of("CODEINDEX_SEARCH_PROVIDER=substring"),
                            null);
                }
                return new LuceneSearchProvider(indexServiceCache);
            case SubstringSearchProvider.NAME:
                return new SubstringSearchProvider();
            default:
                throw new IndexException(
                        "Unknown search provider '" + configured + "'.",
                        null,
                        "Use one of: auto, lucene, substring.");
        }
    }

    static boolean isAvailable(final String className) {
        try {
            Class.forName(className, false, SearchProviders.class.getClassLoader());
            return true;
        } catch (final ClassNotFoundException | LinkageError e) {
            return false;
        }
    }
}
