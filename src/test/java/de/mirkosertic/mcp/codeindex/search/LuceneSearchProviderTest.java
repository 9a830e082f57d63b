package de.mirkosertic.mcp.codeindex.search;

import de.mirkosertic.mcp.codeindex.error.IndexException;
import de.mirkosertic.mcp.codeindex.index.IndexConfig;
import de.mirkosertic.mcp.codeindex.index.IndexServiceCache;
import de.mirkosertic.mcp.codeindex.walker.DirectoryWalker;
import de.mirkosertic.mcp.codeindex.walker.FileEntry;
import de.mirkosertic.mcp.codeindex.walker.WalkOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LuceneSearchProvider Tests")
class LuceneSearchProviderTest {

    @TempDir
    Path tempDir;

    private Path root;
    private IndexServiceCache cache;
    private LuceneSearchProvider provider;

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createDirectories(tempDir.resolve("repo"));
        cache = new IndexServiceCache(IndexConfig.defaults().withIndexDirectory(tempDir.resolve("indexes")));
        provider = new LuceneSearchProvider(cache);
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    private List<FileEntry> collect() throws Exception {
        return new DirectoryWalker().collect(root, WalkOptions.defaults()).files();
    }

    @Test
    @DisplayName("Should order files by index rank and drop non-matching files")
    void ranked() throws Exception {
        // Given
        Files.writeString(root.resolve("other.py"), "# calls the parser");
        Files.writeString(root.resolve("parser.py"), "x = 1");
        Files.writeString(root.resolve("lexer.py"), "tokens = []");
        cache.get(root).indexDirectory(WalkOptions.defaults(), false);

        // When
        final List<FileEntry> result = provider.filterFiles(collect(), "parser", root, 10);

        // Then
        assertThat(result).extracting(FileEntry::path).containsExactly("parser.py", "other.py");
    }

    @Test
    @DisplayName("Should report each path once even if the index holds older versions")
    void deduplicates() throws Exception {
        Files.writeString(root.resolve("parser.py"), "parser v1");
        cache.get(root).indexDirectory(WalkOptions.defaults(), false);
        Files.writeString(root.resolve("parser.py"), "parser v2");
        cache.get(root).indexDirectory(WalkOptions.defaults(), false);

        assertThat(provider.filterFiles(collect(), "parser", root, 10))
                .extracting(FileEntry::path)
                .containsExactly("parser.py");
    }

    @Test
    @DisplayName("Should drop indexed paths that are not in the given file set")
    void onlyGivenFiles() throws Exception {
        Files.writeString(root.resolve("parser.py"), "parser");
        cache.get(root).indexDirectory(WalkOptions.defaults(), false);

        assertThat(provider.filterFiles(List.of(), "parser", root, 10)).isEmpty();
    }

    @Test
    @DisplayName("Should fail without an index")
    void missingIndex() {
        assertThatThrownBy(() -> provider.filterFiles(List.of(), "parser", root, 10))
                .isInstanceOf(IndexException.class);
    }
}
