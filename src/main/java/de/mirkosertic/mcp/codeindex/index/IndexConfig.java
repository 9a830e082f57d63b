package de.mirkosertic.mcp.codeindex.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Storage and ranking settings shared by all per-root indexes.
 *
 * @param indexDirectory          parent directory holding one sub directory per indexed root
 * @param heapSizeMb              RAM buffer of the index writer in MB
 * @param boosts                  per-field weights; iteration order is the query clause order
 * @param replaceChangedDocuments delete by path before re-adding changed files and prune removed
 *                                files; {@code false} keeps the append-only behavior
 */
public record IndexConfig(
        Path indexDirectory,
        int heapSizeMb,
        Map<String, Double> boosts,
        boolean replaceChangedDocuments
) {

    private static final Logger logger = LoggerFactory.getLogger(IndexConfig.class);

    public static final int DEFAULT_HEAP_SIZE_MB = 50;

    public IndexConfig {
        boosts = Collections.unmodifiableMap(validBoosts(boosts));
        if (heapSizeMb <= 0) {
            heapSizeMb = DEFAULT_HEAP_SIZE_MB;
        }
    }

    // Lucene rejects negative and non-finite boosts at query time
    static Map<String, Double> validBoosts(final Map<String, Double> boosts) {
        final Map<String, Double> valid = new LinkedHashMap<>();
        for (final Map.Entry<String, Double> entry : boosts.entrySet()) {
            final Double weight = entry.getValue();
            if (weight == null || !Double.isFinite(weight) || weight < 0) {
                logger.warn("Ignoring boost for field '{}': {} is not a finite, non-negative number",
                        entry.getKey(), weight);
                continue;
            }
            valid.put(entry.getKey(), weight);
        }
        return valid;
    }

    public static Map<String, Double> defaultBoosts() {
        final Map<String, Double> boosts = new LinkedHashMap<>();
        boosts.put(DocumentIndexer.FIELD_PATH_STEM, 3.0);
        boosts.put(DocumentIndexer.FIELD_PATH, 2.0);
        boosts.put(DocumentIndexer.FIELD_CONTENT, 1.0);
        return boosts;
    }

    public static Path defaultIndexDirectory() {
        return Path.of(System.getProperty("user.home"), ".cache", "mcp-code-index", "index");
    }

    public static IndexConfig defaults() {
        return new IndexConfig(defaultIndexDirectory(), DEFAULT_HEAP_SIZE_MB, defaultBoosts(), false);
    }

    public IndexConfig withIndexDirectory(final Path directory) {
        return new IndexConfig(directory, heapSizeMb, boosts, replaceChangedDocuments);
    }

    public IndexConfig withReplaceChangedDocuments(final boolean replace) {
        return new IndexConfig(indexDirectory, heapSizeMb, boosts, replace);
    }
}
