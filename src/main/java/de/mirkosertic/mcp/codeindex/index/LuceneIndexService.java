package de.mirkosertic.mcp.codeindex.index;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import de.mirkosertic.mcp.codeindex.config.BuildInfo;
import de.mirkosertic.mcp.codeindex.error.CodeIndexException;
import de.mirkosertic.mcp.codeindex.error.IndexException;
import de.mirkosertic.mcp.codeindex.walker.DirectoryWalker;
import de.mirkosertic.mcp.codeindex.walker.FileEntry;
import de.mirkosertic.mcp.codeindex.walker.WalkOptions;
import de.mirkosertic.mcp.codeindex.walker.WalkResult;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.SegmentInfos;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.store.Lock;
import org.apache.lucene.store.LockObtainFailedException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Incremental Lucene index for exactly one root directory.
 * <p>
 * The index lives at {@code <indexDirectory>/<rootHash>} next to its {@code metadata.json}.
 * A build holds one {@link IndexWriter} for its whole duration and commits once at the end, so
 * a crash before the commit leaves the previously committed state. Lucene's {@code write.lock}
 * rejects a second writer on the same root.
 * <p>
 * Queries go through a {@link SearcherManager} that is refreshed before every search, so a
 * query observes every commit that happened before it started.
 */
public class LuceneIndexService implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(LuceneIndexService.class);

    static final String SCHEMA_VERSION_KEY = "schema_version";
    static final String SOFTWARE_VERSION_KEY = "software_version";

    private final Path root;
    private final Path indexPath;
    private final IndexConfig config;
    private final DocumentIndexer documentIndexer;
    private final IndexMetadataStore metadataStore;
    private final DirectoryWalker directoryWalker;
    private final Analyzer analyzer;
    private final QueryPlanner queryPlanner;

    private @Nullable Directory directory;
    private @Nullable SearcherManager searcherManager;

    public LuceneIndexService(final Path root, final IndexConfig config, final DocumentIndexer documentIndexer,
                              final IndexMetadataStore metadataStore, final DirectoryWalker directoryWalker) {
        this.root = IndexPaths.normalizeRoot(root);
        this.indexPath = IndexPaths.indexPathFor(config.indexDirectory(), this.root);
        this.config = config;
        this.documentIndexer = documentIndexer;
        this.metadataStore = metadataStore;
        this.directoryWalker = directoryWalker;
        this.analyzer = new SourceCodeAnalyzer();
        this.queryPlanner = new QueryPlanner(analyzer);
    }

    public LuceneIndexService(final Path root, final IndexConfig config) {
        this(root, config, new DocumentIndexer(), new IndexMetadataStore(), new DirectoryWalker());
    }

    public Path getRoot() {
        return root;
    }

    public Path getIndexPath() {
        return indexPath;
    }

    public boolean indexExists() throws IOException {
        if (!Files.isDirectory(indexPath)) {
            return false;
        }
        return DirectoryReader.indexExists(openDirectory());
    }

    /**
     * Walks the root and writes every new or changed file.
     *
     * @param force delete the whole index first and rebuild from scratch
     */
    public synchronized IndexResult indexDirectory(final WalkOptions options, final boolean force)
            throws CodeIndexException, IOException {
        final WalkResult walk = directoryWalker.collect(root, options);
        if (force) {
            clear();
        }
        Files.createDirectories(indexPath);
        final Directory dir = openDirectory();

        final int storedSchemaVersion = readSchemaVersion(dir);
        final boolean schemaChanged = storedSchemaVersion != -1 && storedSchemaVersion != DocumentIndexer.SCHEMA_VERSION;
        if (schemaChanged) {
            logger.warn("Index {} has schema version {}, current is {}; rebuilding", indexPath,
                    storedSchemaVersion, DocumentIndexer.SCHEMA_VERSION);
        }

        final long start = System.currentTimeMillis();
        logger.info("Indexing {} into {} (force={})", root, indexPath, force);

        try (final IndexWriter writer = openWriter(dir)) {
            IndexMetadata metadata = metadataStore.load(indexPath, root.toString());
            if (schemaChanged) {
                writer.deleteAll();
                metadata = IndexMetadata.empty(root.toString());
            }

            final boolean replace = config.replaceChangedDocuments();
            int indexedCount = 0;
            int skippedCount = 0;

            for (final FileEntry entry : walk.files()) {
                final String sha256 = ContentFingerprinter.fingerprint(entry.content());
                if (metadata.isUnchanged(entry.path(), sha256)) {
                    skippedCount++;
                    continue;
                }
                final Document document = documentIndexer.createDocument(entry, DocumentIndexer.docId(indexedCount + 1), sha256);
                documentIndexer.indexDocument(writer, document, replace);
                metadata.recordFile(entry.path(), sha256, Instant.now().toString());
                indexedCount++;
            }

            int prunedCount = 0;
            if (replace) {
                final Set<String> present = new HashSet<>();
                for (final FileEntry entry : walk.files()) {
                    present.add(entry.path());
                }
                for (final String path : List.copyOf(metadata.paths())) {
                    if (!present.contains(path)) {
                        documentIndexer.deleteDocument(writer, path);
                        metadata.removeFile(path);
                        prunedCount++;
                    }
                }
            }

            writer.setLiveCommitData(Map.of(
                    SCHEMA_VERSION_KEY, String.valueOf(DocumentIndexer.SCHEMA_VERSION),
                    SOFTWARE_VERSION_KEY, BuildInfo.getVersion()
            ).entrySet());
            writer.commit();
            metadataStore.save(indexPath, metadata);

            logger.info("Indexed {} files, skipped {}, pruned {} in {}ms ({} warnings)", indexedCount, skippedCount,
                    prunedCount, System.currentTimeMillis() - start, walk.warnings().size());
            for (final String warning : walk.warnings()) {
                logger.warn("{}", warning);
            }
            return new IndexResult(indexedCount, skippedCount, prunedCount, walk.totalBytes(), walk.warnings(), indexPath);
        }
    }

    /**
     * Ranked search over path, stem and content.
     * <p>
     * The language filter is applied to the top {@code limit} hits after ranking, so fewer than
     * {@code limit} results may come back even though more matching documents exist.
     */
    public synchronized List<SearchResult> search(final String queryString, final int limit,
                                                  final @Nullable String language) throws IndexException, IOException {
        ensureIndex();
        if (limit <= 0) {
            return List.of();
        }

        final SearcherManager manager = searcherManager();
        manager.maybeRefreshBlocking();
        final IndexSearcher searcher = manager.acquire();
        try {
            final Query query = queryPlanner.plan(queryString, config.boosts());
            final TopDocs topDocs = searcher.search(query, limit);
            final List<SearchResult> results = new ArrayList<>();
            for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
                final Document doc = searcher.storedFields().document(scoreDoc.doc);
                final String docLanguage = doc.get(DocumentIndexer.FIELD_LANGUAGE);
                if (language != null && !language.isBlank() && !language.equals(docLanguage)) {
                    continue;
                }
                final Number bytesSize = doc.getField(DocumentIndexer.FIELD_BYTES_SIZE).numericValue();
                results.add(new SearchResult(
                        doc.get(DocumentIndexer.FIELD_PATH),
                        scoreDoc.score,
                        docLanguage,
                        doc.get(DocumentIndexer.FIELD_DOC_ID),
                        doc.get(DocumentIndexer.FIELD_SHA256),
                        bytesSize.longValue(),
                        null));
            }
            logger.debug("Query '{}' returned {} of {} hits", queryString, results.size(), topDocs.totalHits.value);
            return results;
        } finally {
            manager.release(searcher);
        }
    }

    public synchronized long getDocumentCount() throws IndexException, IOException {
        ensureIndex();
        final SearcherManager manager = searcherManager();
        manager.maybeRefreshBlocking();
        final IndexSearcher searcher = manager.acquire();
        try {
            return searcher.getIndexReader().numDocs();
        } finally {
            manager.release(searcher);
        }
    }

    /**
     * @return the schema version of the last commit, or {@code -1} if there is none
     */
    public synchronized int getSchemaVersion() throws IndexException, IOException {
        ensureIndex();
        return readSchemaVersion(openDirectory());
    }

    public synchronized Set<String> getIndexedPaths() throws IndexException, IOException {
        ensureIndex();
        return metadataStore.load(indexPath, root.toString()).paths();
    }

    /**
     * Deletes the index and its metadata. Clearing an absent index is a no-op.
     *
     * @return {@code true} if there was something to delete
     */
    public synchronized boolean clear() throws IOException {
        closeHandles();
        if (!Files.exists(indexPath)) {
            return false;
        }
        MoreFiles.deleteRecursively(indexPath, RecursiveDeleteOption.ALLOW_INSECURE);
        logger.info("Cleared index {} for {}", indexPath, root);
        return true;
    }

    public Path getLockFilePath() {
        return indexPath.resolve(IndexWriter.WRITE_LOCK_NAME);
    }

    /**
     * Native locks leave the lock file behind after release, so presence alone does not mean
     * a writer is active. See {@link #isLocked()}.
     */
    public boolean isLockFilePresent() {
        return Files.exists(getLockFilePath());
    }

    /**
     * @return {@code true} if some writer currently holds the index lock
     */
    public synchronized boolean isLocked() throws IOException {
        if (!Files.isDirectory(indexPath)) {
            return false;
        }
        try (final Lock ignored = openDirectory().obtainLock(IndexWriter.WRITE_LOCK_NAME)) {
            return false;
        } catch (final LockObtainFailedException e) {
            return true;
        }
    }

    /**
     * Removes the lock file. Only use this when no other process is writing to the index.
     *
     * @return true if the lock file was deleted, false if it didn't exist
     */
    public synchronized boolean removeLockFile() throws IOException {
        closeHandles();
        final Path lockPath = getLockFilePath();
        if (Files.deleteIfExists(lockPath)) {
            logger.warn("Removed lock file: {}", lockPath);
            return true;
        }
        return false;
    }

    @Override
    public synchronized void close() throws IOException {
        closeHandles();
    }

    private void ensureIndex() throws IndexException, IOException {
        if (!indexExists()) {
            throw new IndexException(
                    "Index does not exist.",
                    "No index found for '" + root + "' at '" + indexPath + "'.",
                    "Run indexDirectory for " + root + " to create one.",
                    List.of("indexDirectory root=" + root),
                    null);
        }
    }

    private IndexWriter openWriter(final Directory dir) throws IndexException, IOException {
        final IndexWriterConfig writerConfig = new IndexWriterConfig(analyzer);
        writerConfig.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        writerConfig.setRAMBufferSizeMB(config.heapSizeMb());
        try {
            return new IndexWriter(dir, writerConfig);
        } catch (final LockObtainFailedException e) {
            throw new IndexException(
                    "Index is locked.",
                    "Another writer holds '" + getLockFilePath() + "'.",
                    "Wait for the other indexing run to finish. If it crashed, remove the stale lock.",
                    List.of("unlockIndex root=" + root + " confirm=true"),
                    e);
        }
    }

    private static int readSchemaVersion(final Directory dir) throws IOException {
        if (!DirectoryReader.indexExists(dir)) {
            return -1;
        }
        final String value = SegmentInfos.readLatestCommit(dir).getUserData().get(SCHEMA_VERSION_KEY);
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value);
        } catch (final NumberFormatException e) {
            logger.warn("Invalid schema version '{}' in commit data", value);
            return 0;
        }
    }

    private Directory openDirectory() throws IOException {
        if (directory == null) {
            directory = FSDirectory.open(indexPath);
        }
        return directory;
    }

    private SearcherManager searcherManager() throws IOException {
        if (searcherManager == null) {
            searcherManager = new SearcherManager(openDirectory(), null);
        }
        return searcherManager;
    }

    private void closeHandles() throws IOException {
        if (searcherManager != null) {
            searcherManager.close();
            searcherManager = null;
        }
        if (directory != null) {
            directory.close();
            directory = null;
        }
    }
}
