package de.mirkosertic.mcp.codeindex.index;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Function;

/**
 * Holds the index service of the most recently used root.
 * <p>
 * Asking for a different root closes the cached service before the new one is created.
 */
public class IndexServiceCache implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(IndexServiceCache.class);

    private final Function<Path, LuceneIndexService> factory;

    private @Nullable Path cachedRoot;
    private @Nullable LuceneIndexService cachedService;

    public IndexServiceCache(final IndexConfig config) {
        this(root -> new LuceneIndexService(root, config));
    }

    public IndexServiceCache(final Function<Path, LuceneIndexService> factory) {
        this.factory = factory;
    }

    public synchronized LuceneIndexService get(final Path root) {
        final Path normalized = IndexPaths.normalizeRoot(root);
        if (cachedService != null && normalized.equals(cachedRoot)) {
            return cachedService;
        }
        invalidate();
        cachedService = factory.apply(normalized);
        cachedRoot = normalized;
        logger.debug("Opened index service for {}", normalized);
        return cachedService;
    }

    public synchronized @Nullable Path cachedRoot() {
        return cachedRoot;
    }

    /**
     * Closes and forgets the cached service, if any.
     */
    public synchronized void invalidate() {
        if (cachedService != null) {
            try {
                cachedService.close();
            } catch (final IOException e) {
                logger.warn("Failed to close index service for {}", cachedRoot, e);
            }
        }
        cachedService = null;
        cachedRoot = null;
    }

    @Override
    public void close() {
        invalidate();
    }
}
