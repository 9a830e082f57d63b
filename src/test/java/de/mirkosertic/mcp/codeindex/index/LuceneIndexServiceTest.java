package de.mirkosertic.mcp.codeindex.index;

import de.mirkosertic.mcp.codeindex.error.IndexException;
import de.mirkosertic.mcp.codeindex.walker.WalkOptions;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LuceneIndexService Tests")
class LuceneIndexServiceTest {

    @TempDir
    Path tempDir;

    private Path root;
    private Path indexDirectory;
    private LuceneIndexService service;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createDirectories(tempDir.resolve("repo"));
        indexDirectory = tempDir.resolve("indexes");
        service = new LuceneIndexService(root, IndexConfig.defaults().withIndexDirectory(indexDirectory));
    }

    @AfterEach
    void tearDown() throws IOException {
        service.close();
    }

    private void write(final String relativePath, final String content) throws IOException {
        final Path file = root.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private IndexResult index() throws Exception {
        return service.indexDirectory(WalkOptions.defaults(), false);
    }

    @Test
    @DisplayName("Should store the index under the hashed root directory")
    void indexLocation() throws Exception {
        write("a.py", "print('a')");

        final IndexResult result = index();

        assertThat(result.indexPath()).isEqualTo(IndexPaths.indexPathFor(indexDirectory, root));
        assertThat(result.indexPath().resolve(IndexMetadataStore.METADATA_FILE)).exists();
        assertThat(service.indexExists()).isTrue();
        assertThat(service.getSchemaVersion()).isEqualTo(DocumentIndexer.SCHEMA_VERSION);
    }

    @Nested
    @DisplayName("Incremental builds")
    class IncrementalBuilds {

        @Test
        @DisplayName("Should skip every file on an unchanged second build")
        void idempotent() throws Exception {
            // Given
            write("a.py", "alpha");
            write("b.md", "beta");
            final IndexResult first = index();

            // When
            final IndexResult second = index();

            // Then
            assertThat(first.indexedCount()).isEqualTo(2);
            assertThat(first.skippedCount()).isZero();
            assertThat(first.totalBytes()).isEqualTo(9);
            assertThat(second.indexedCount()).isZero();
            assertThat(second.skippedCount()).isEqualTo(2);
            assertThat(service.getDocumentCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should keep skipping unchanged files when metadata carries extra keys")
        void metadataWithExtraKeys() throws Exception {
            // Given
            write("a.py", "alpha");
            final IndexResult first = index();
            final Path metadataFile = first.indexPath().resolve(IndexMetadataStore.METADATA_FILE);
            Files.writeString(metadataFile, Files.readString(metadataFile).replaceFirst("\\{", "{\"version\": 1, "));

            // When
            final IndexResult second = index();

            // Then
            assertThat(second.indexedCount()).isZero();
            assertThat(second.skippedCount()).isEqualTo(1);
            assertThat(service.getDocumentCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should re-index only files whose content changed")
        void changeDetection() throws Exception {
            write("a.py", "alpha");
            write("b.md", "beta");
            index();

            write("a.py", "alpha changed");
            final IndexResult result = index();

            assertThat(result.indexedCount()).isEqualTo(1);
            assertThat(result.skippedCount()).isEqualTo(1);
            assertThat(service.getIndexedPaths()).containsExactly("a.py", "b.md");
        }

        @Test
        @DisplayName("Should keep the previous version of a changed file by default")
        void appendKeepsDuplicates() throws Exception {
            write("a.py", "alpha");
            write("b.md", "beta");
            index();

            write("a.py", "alpha changed");
            index();

            assertThat(service.getDocumentCount()).isEqualTo(3);
            assertThat(service.search("alpha", 10, null))
                    .extracting(SearchResult::path)
                    .containsExactly("a.py", "a.py");
        }

        @Test
        @DisplayName("Should rebuild everything when forced")
        void force() throws Exception {
            write("a.py", "alpha");
            write("b.md", "beta");
            index();
            write("a.py", "alpha changed");
            index();

            final IndexResult result = service.indexDirectory(WalkOptions.defaults(), true);

            assertThat(result.indexedCount()).isEqualTo(2);
            assertThat(result.skippedCount()).isZero();
            assertThat(service.getDocumentCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should keep entries of deleted files by default")
        void noPruningByDefault() throws Exception {
            write("a.py", "alpha");
            write("b.md", "beta");
            index();

            Files.delete(root.resolve("b.md"));
            final IndexResult result = index();

            assertThat(result.prunedCount()).isZero();
            assertThat(service.getIndexedPaths()).containsExactly("a.py", "b.md");
        }

        @Test
        @DisplayName("Should forward walk warnings")
        void warnings() throws Exception {
            write("big.txt", "x".repeat(100));
            write("small.txt", "x");

            final IndexResult result = service.indexDirectory(WalkOptions.builder().maxFileBytes(10L).build(), false);

            assertThat(result.indexedCount()).isEqualTo(1);
            assertThat(result.warnings()).containsExactly("Skipping big.txt (size 100 > max 10)");
        }
    }

    @Nested
    @DisplayName("Replace mode")
    class ReplaceMode {

        private LuceneIndexService replacing;

        @BeforeEach
        void setUp() {
            replacing = new LuceneIndexService(root, IndexConfig.defaults()
                    .withIndexDirectory(tempDir.resolve("replace-indexes"))
                    .withReplaceChangedDocuments(true));
        }

        @AfterEach
        void tearDown() throws IOException {
            replacing.close();
        }

        @Test
        @DisplayName("Should replace the previous version of a changed file")
        void replacesChangedDocuments() throws Exception {
            write("a.py", "alpha");
            write("b.md", "beta");
            replacing.indexDirectory(WalkOptions.defaults(), false);

            write("a.py", "alpha changed");
            replacing.indexDirectory(WalkOptions.defaults(), false);

            assertThat(replacing.getDocumentCount()).isEqualTo(2);
            assertThat(replacing.search("alpha", 10, null)).hasSize(1);
        }

        @Test
        @DisplayName("Should prune files that disappeared from disk")
        void prunes() throws Exception {
            write("a.py", "alpha");
            write("b.md", "beta");
            replacing.indexDirectory(WalkOptions.defaults(), false);

            Files.delete(root.resolve("b.md"));
            final IndexResult result = replacing.indexDirectory(WalkOptions.defaults(), false);

            assertThat(result.prunedCount()).isEqualTo(1);
            assertThat(replacing.getIndexedPaths()).containsExactly("a.py");
            assertThat(replacing.getDocumentCount()).isEqualTo(1);
            assertThat(replacing.search("beta", 10, null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Search")
    class Search {

        @Test
        @DisplayName("Should find a file by content with a positive score")
        void findsByContent() throws Exception {
            write("src/hello.py", "def hello():\n    return 'world'\n");
            write("README.md", "Project notes");
            index();

            final List<SearchResult> results = service.search("hello", 10, null);

            assertThat(results).isNotEmpty();
            final SearchResult first = results.get(0);
            assertThat(first.path()).isEqualTo("src/hello.py");
            assertThat(first.score()).isPositive();
            assertThat(first.language()).isEqualTo("python");
            assertThat(first.docId()).startsWith("doc-");
            assertThat(first.sha256()).hasSize(64);
            assertThat(first.bytesSize()).isEqualTo(Files.size(root.resolve("src/hello.py")));
            assertThat(first.snippet()).isNull();
        }

        @Test
        @DisplayName("Should rank a path stem match above a content match")
        void stemBoost() throws Exception {
            write("parser.py", "x = 1");
            write("other.py", "# uses the parser");
            index();

            assertThat(service.search("parser", 10, null))
                    .extracting(SearchResult::path)
                    .containsExactly("parser.py", "other.py");
        }

        @Test
        @DisplayName("Should keep only hits of the requested language")
        void languageFilter() throws Exception {
            write("worker.py", "def run(): queue");
            write("notes.md", "queue design");
            index();

            assertThat(service.search("queue", 10, "python"))
                    .extracting(SearchResult::path)
                    .containsExactly("worker.py");
        }

        @Test
        @DisplayName("Should apply the language filter after truncating to the limit")
        void filterAfterTruncation() throws Exception {
            // Given - three markdown files outrank the python file through their path
            write("alpha-notes.md", "alpha");
            write("alpha-guide.md", "alpha");
            write("alpha-plan.md", "alpha");
            write("worker.py", "alpha");
            index();

            // When
            final List<SearchResult> truncated = service.search("alpha", 2, "python");
            final List<SearchResult> wide = service.search("alpha", 10, "python");

            // Then
            assertThat(truncated).isEmpty();
            assertThat(wide).extracting(SearchResult::path).containsExactly("worker.py");
        }

        @Test
        @DisplayName("Should return nothing for a non-positive limit")
        void zeroLimit() throws Exception {
            write("a.py", "alpha");
            index();

            assertThat(service.search("alpha", 0, null)).isEmpty();
        }

        @Test
        @DisplayName("Should tolerate invalid query syntax")
        void invalidSyntax() throws Exception {
            write("a.py", "foo(bar)");
            index();

            assertThat(service.search("foo(bar", 10, null))
                    .extracting(SearchResult::path)
                    .containsExactly("a.py");
        }

        @Test
        @DisplayName("Should still find documents when the query ends in a boolean operator")
        void danglingOperator() throws Exception {
            write("a.py", "hello world");
            index();

            assertThat(service.search("hello AND", 10, null)).extracting(SearchResult::path).containsExactly("a.py");
            assertThat(service.search("hello OR", 10, null)).extracting(SearchResult::path).containsExactly("a.py");
        }

        @Test
        @DisplayName("Should see documents committed after the first search")
        void freshness() throws Exception {
            write("a.py", "alpha");
            index();
            assertThat(service.search("gamma", 10, null)).isEmpty();

            write("c.py", "gamma");
            index();

            assertThat(service.search("gamma", 10, null))
                    .extracting(SearchResult::path)
                    .containsExactly("c.py");
        }

        @Test
        @DisplayName("Should fail when no index exists")
        void missingIndex() {
            assertThatThrownBy(() -> service.search("alpha", 10, null))
                    .isInstanceOf(IndexException.class)
                    .hasMessage("Index does not exist.")
                    .satisfies(e -> assertThat(((IndexException) e).getTrySteps())
                            .containsExactly("indexDirectory root=" + service.getRoot()));
            assertThatThrownBy(() -> service.getDocumentCount()).isInstanceOf(IndexException.class);
        }
    }

    @Nested
    @DisplayName("Clearing")
    class Clearing {

        @Test
        @DisplayName("Should delete the index and its metadata")
        void clear() throws Exception {
            write("a.py", "alpha");
            index();

            service.clear();

            assertThat(service.getIndexPath()).doesNotExist();
            assertThat(service.indexExists()).isFalse();
        }

        @Test
        @DisplayName("Should be a no-op for an absent index")
        void clearIsIdempotent() throws Exception {
            service.clear();
            service.clear();

            assertThat(service.indexExists()).isFalse();
        }

        @Test
        @DisplayName("Should index everything again after clearing")
        void reindexAfterClear() throws Exception {
            write("a.py", "alpha");
            index();
            service.clear();

            final IndexResult result = index();

            assertThat(result.indexedCount()).isEqualTo(1);
            assertThat(service.search("alpha", 10, null)).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Locking")
    class Locking {

        private IndexWriter openForeignWriter(final Directory directory) throws IOException {
            return new IndexWriter(directory, new IndexWriterConfig(new SourceCodeAnalyzer()));
        }

        @Test
        @DisplayName("Should reject a second writer on the same root")
        void lockConflict() throws Exception {
            write("a.py", "alpha");
            index();

            try (final Directory directory = FSDirectory.open(service.getIndexPath());
                 final IndexWriter ignored = openForeignWriter(directory)) {
                assertThat(service.isLocked()).isTrue();
                assertThatThrownBy(LuceneIndexServiceTest.this::index)
                        .isInstanceOf(IndexException.class)
                        .hasMessage("Index is locked.")
                        .satisfies(e -> assertThat(((IndexException) e).getTrySteps())
                                .containsExactly("unlockIndex root=" + service.getRoot() + " confirm=true"));
            }

            assertThat(service.isLocked()).isFalse();
            assertThat(index().skippedCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should report the lock file path inside the index directory")
        void lockFilePath() {
            assertThat(service.getLockFilePath()).isEqualTo(service.getIndexPath().resolve("write.lock"));
        }

        @Test
        @DisplayName("Should remove a leftover lock file")
        void removeLockFile() throws Exception {
            write("a.py", "alpha");
            index();
            assertThat(service.isLockFilePresent()).isTrue();

            assertThat(service.removeLockFile()).isTrue();
            assertThat(service.isLockFilePresent()).isFalse();
            assertThat(service.removeLockFile()).isFalse();
        }

        @Test
        @DisplayName("Should not report a lock without an index")
        void noIndexNoLock() throws Exception {
            assertThat(service.isLocked()).isFalse();
            assertThat(service.isLockFilePresent()).isFalse();
        }
    }

    @Test
    @DisplayName("Should rebuild an index written with another schema version")
    void schemaMismatch() throws Exception {
        // Given - an index committed with a foreign schema and metadata claiming the file is current
        write("a.py", "alpha");
        final Path indexPath = service.getIndexPath();
        Files.createDirectories(indexPath);
        try (final Directory directory = FSDirectory.open(indexPath);
             final IndexWriter writer = new IndexWriter(directory, new IndexWriterConfig(new SourceCodeAnalyzer()))) {
            final Document stale = new Document();
            stale.add(new StringField("legacy", "yes", Field.Store.YES));
            writer.addDocument(stale);
            writer.setLiveCommitData(Map.of(LuceneIndexService.SCHEMA_VERSION_KEY, "99").entrySet());
            writer.commit();
        }
        final IndexMetadata metadata = IndexMetadata.empty(service.getRoot().toString());
        metadata.recordFile("a.py", ContentFingerprinter.fingerprint("alpha"), "2024-01-01T00:00:00Z");
        new IndexMetadataStore().save(indexPath, metadata);

        // When
        final IndexResult result = index();

        // Then
        assertThat(result.indexedCount()).isEqualTo(1);
        assertThat(service.getSchemaVersion()).isEqualTo(DocumentIndexer.SCHEMA_VERSION);
        assertThat(service.getDocumentCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep indexes of different roots apart")
    void rootIsolation() throws Exception {
        // Given
        final Path otherRoot = Files.createDirectories(tempDir.resolve("other"));
        Files.writeString(otherRoot.resolve("b.py"), "beta");
        write("a.py", "alpha");

        try (final LuceneIndexService other = new LuceneIndexService(otherRoot,
                IndexConfig.defaults().withIndexDirectory(indexDirectory))) {
            // When
            index();
            other.indexDirectory(WalkOptions.defaults(), false);

            // Then
            assertThat(other.getIndexPath()).isNotEqualTo(service.getIndexPath());
            assertThat(service.search("beta", 10, null)).isEmpty();
            assertThat(other.search("alpha", 10, null)).isEmpty();
            assertThat(other.search("beta", 10, null)).extracting(SearchResult::path).containsExactly("b.py");
        }
    }
}
