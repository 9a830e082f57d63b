package de.mirkosertic.mcp.codeindex;

import de.mirkosertic.mcp.codeindex.config.ApplicationConfig;
import de.mirkosertic.mcp.codeindex.config.BuildInfo;
import de.mirkosertic.mcp.codeindex.error.CodeIndexException;
import de.mirkosertic.mcp.codeindex.error.InputException;
import de.mirkosertic.mcp.codeindex.index.IndexResult;
import de.mirkosertic.mcp.codeindex.index.IndexServiceCache;
import de.mirkosertic.mcp.codeindex.index.LuceneIndexService;
import de.mirkosertic.mcp.codeindex.index.SearchResult;
import de.mirkosertic.mcp.codeindex.mcp.SchemaGenerator;
import de.mirkosertic.mcp.codeindex.mcp.ToolResultHelper;
import de.mirkosertic.mcp.codeindex.mcp.dto.ClearIndexResponse;
import de.mirkosertic.mcp.codeindex.mcp.dto.FindFilesRequest;
import de.mirkosertic.mcp.codeindex.mcp.dto.FindFilesResponse;
import de.mirkosertic.mcp.codeindex.mcp.dto.IndexDirectoryRequest;
import de.mirkosertic.mcp.codeindex.mcp.dto.IndexDirectoryResponse;
import de.mirkosertic.mcp.codeindex.mcp.dto.IndexStatsResponse;
import de.mirkosertic.mcp.codeindex.mcp.dto.IndexedPathsResponse;
import de.mirkosertic.mcp.codeindex.mcp.dto.RootRequest;
import de.mirkosertic.mcp.codeindex.mcp.dto.SearchHit;
import de.mirkosertic.mcp.codeindex.mcp.dto.SearchRequest;
import de.mirkosertic.mcp.codeindex.mcp.dto.SearchResponse;
import de.mirkosertic.mcp.codeindex.mcp.dto.UnlockIndexRequest;
import de.mirkosertic.mcp.codeindex.mcp.dto.UnlockIndexResponse;
import de.mirkosertic.mcp.codeindex.search.SearchProvider;
import de.mirkosertic.mcp.codeindex.walker.DirectoryWalker;
import de.mirkosertic.mcp.codeindex.walker.FileEntry;
import de.mirkosertic.mcp.codeindex.walker.WalkOptions;
import de.mirkosertic.mcp.codeindex.walker.WalkResult;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * MCP tools for incremental code indexing and ranked search.
 * <p>
 * Handlers never throw. Typed failures are returned as {@code success=false} with an error payload
 * holding {@code type}, {@code message}, {@code hint} and {@code try}.
 */
public class CodeIndexTools {

    private static final Logger logger = LoggerFactory.getLogger(CodeIndexTools.class);

    private static final String INDEX_DESCRIPTION = """
            Build or update the full text index of a directory. Only new and changed files are \
            (re)indexed; unchanged files are skipped by content hash. Respects .gitignore, skips hidden \
            files, lockfiles, binaries and dependency directories. Use force=true for a clean rebuild. \
            Returns indexed/skipped counts, total bytes, walk warnings and the on-disk index path.""";

    private static final String SEARCH_DESCRIPTION = """
            Ranked full text search over an indexed directory. The query is matched against the file \
            name stem (boost 3), the relative path (boost 2) and the content (boost 1). \
            Supports Lucene query syntax: terms, "phrases", AND/OR/NOT, wildcards like 'pars*'. \
            Identifiers are split on non alphanumeric characters, so 'hello_world' matches 'hello'. \
            The optional language filter (python, javascript, typescript, markdown, java, go, rust, ...) \
            is applied AFTER the limit, so fewer than 'limit' hits may be returned. \
            Run indexDirectory first.""";

    private final ApplicationConfig config;
    private final IndexServiceCache indexServiceCache;
    private final SearchProvider searchProvider;
    private final DirectoryWalker directoryWalker;

    public CodeIndexTools(final ApplicationConfig config, final IndexServiceCache indexServiceCache,
                          final SearchProvider searchProvider, final DirectoryWalker directoryWalker) {
        this.config = config;
        this.indexServiceCache = indexServiceCache;
        this.searchProvider = searchProvider;
        this.directoryWalker = directoryWalker;
    }

    /**
     * Returns all MCP tool specifications for registration with the MCP server.
     */
    public List<McpServerFeatures.SyncToolSpecification> getToolSpecifications() {
        final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("indexDirectory")
                        .description(INDEX_DESCRIPTION)
                        .inputSchema(SchemaGenerator.generateSchema(IndexDirectoryRequest.class))
                        .build())
                .callHandler((exchange, request) -> indexDirectory(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("search")
                        .description(SEARCH_DESCRIPTION)
                        .inputSchema(SchemaGenerator.generateSchema(SearchRequest.class))
                        .build())
                .callHandler((exchange, request) -> search(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("findFiles")
                        .description("Collect the files of a directory with the default walk rules and return the ones " +
                                "most relevant to a query, best first. With the ranked index, new or changed files are " +
                                "indexed first; otherwise a case-insensitive substring match is used.")
                        .inputSchema(SchemaGenerator.generateSchema(FindFilesRequest.class))
                        .build())
                .callHandler((exchange, request) -> findFiles(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("clearIndex")
                        .description("Delete the index and its metadata for a directory. Clearing a missing index is not an error.")
                        .inputSchema(SchemaGenerator.generateSchema(RootRequest.class))
                        .build())
                .callHandler((exchange, request) -> clearIndex(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("listIndexedPaths")
                        .description("List the relative paths recorded as indexed for a directory.")
                        .inputSchema(SchemaGenerator.generateSchema(RootRequest.class))
                        .build())
                .callHandler((exchange, request) -> listIndexedPaths(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getIndexStats")
                        .description("Get statistics about the index of a directory: document count, indexed paths, " +
                                "schema version, lock state and server version.")
                        .inputSchema(SchemaGenerator.generateSchema(RootRequest.class))
                        .build())
                .callHandler((exchange, request) -> getIndexStats(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("unlockIndex")
                        .description("Remove a stale write.lock left behind by a crashed indexing run. " +
                                "Requires confirm=true. Only use this if no other process is indexing the directory.")
                        .inputSchema(SchemaGenerator.generateSchema(UnlockIndexRequest.class))
                        .build())
                .callHandler((exchange, request) -> unlockIndex(request.arguments()))
                .build());

        return tools;
    }

    McpSchema.CallToolResult indexDirectory(final Map<String, Object> args) {
        final IndexDirectoryRequest request = IndexDirectoryRequest.fromMap(args);
        logger.info("Index request: root='{}', force={}", request.root(), request.isForce());

        try {
            final Path root = requireRoot(request.root());
            final long start = System.currentTimeMillis();
            final IndexResult result = indexServiceCache.get(root)
                    .indexDirectory(request.toWalkOptions(config.getWalkDefaults()), request.isForce());
            return ToolResultHelper.createResult(IndexDirectoryResponse.success(result, System.currentTimeMillis() - start));
        } catch (final CodeIndexException e) {
            logger.warn("Indexing failed: {}", e.toText());
            return ToolResultHelper.createResult(IndexDirectoryResponse.error(ToolResultHelper.errorPayload(e)));
        } catch (final IOException | RuntimeException e) {
            logger.error("Error indexing {}", request.root(), e);
            return ToolResultHelper.createResult(IndexDirectoryResponse.error(
                    ToolResultHelper.errorPayload("Error indexing directory: " + e.getMessage())));
        }
    }

    McpSchema.CallToolResult search(final Map<String, Object> args) {
        final SearchRequest request = SearchRequest.fromMap(args);
        logger.info("Search request: root='{}', query='{}', limit={}, language={}",
                request.root(), request.query(), request.limit(), request.language());

        try {
            final Path root = requireRoot(request.root());
            if (request.query() == null || request.query().isBlank()) {
                throw new InputException("Query is empty.", null, "Pass a non-empty query.");
            }
            final long start = System.currentTimeMillis();
            final List<SearchResult> results = indexServiceCache.get(root).search(request.query(),
                    request.effectiveLimit(config.getDefaultSearchLimit()), request.language());
            final List<SearchHit> hits = new ArrayList<>(results.size());
            for (final SearchResult result : results) {
                hits.add(SearchHit.from(result));
            }
            final long durationMs = System.currentTimeMillis() - start;
            logger.info("Search completed in {}ms with {} hits", durationMs, hits.size());
            return ToolResultHelper.createResult(SearchResponse.success(hits, durationMs));
        } catch (final CodeIndexException e) {
            logger.warn("Search failed: {}", e.toText());
            return ToolResultHelper.createResult(SearchResponse.error(ToolResultHelper.errorPayload(e)));
        } catch (final IOException | RuntimeException e) {
            logger.error("Search error", e);
            return ToolResultHelper.createResult(SearchResponse.error(
                    ToolResultHelper.errorPayload("Search error: " + e.getMessage())));
        }
    }

    McpSchema.CallToolResult findFiles(final Map<String, Object> args) {
        final FindFilesRequest request = FindFilesRequest.fromMap(args);
        logger.info("Find files request: root='{}', query='{}', provider={}", request.root(), request.query(),
                searchProvider.name());

        try {
            final Path root = requireRoot(request.root());
            if (request.query() == null || request.query().isBlank()) {
                throw new InputException("Query is empty.", null, "Pass a non-empty query.");
            }
            final WalkOptions walkOptions = config.getWalkDefaults();
            if (searchProvider.requiresIndex()) {
                final IndexResult warmed = indexServiceCache.get(root).indexDirectory(walkOptions, false);
                logger.debug("Index for {} refreshed before findFiles: {} indexed, {} skipped", root,
                        warmed.indexedCount(), warmed.skippedCount());
            }
            final WalkResult walk = directoryWalker.collect(root, walkOptions);
            final List<FileEntry> selected = searchProvider.filterFiles(walk.files(), request.query(), root,
                    request.effectiveLimit());
            final List<FindFilesResponse.FoundFile> files = new ArrayList<>(selected.size());
            for (final FileEntry entry : selected) {
                files.add(new FindFilesResponse.FoundFile(entry.path(), entry.size()));
            }
            return ToolResultHelper.createResult(FindFilesResponse.success(searchProvider.name(), files, walk.warnings()));
        } catch (final CodeIndexException e) {
            logger.warn("Find files failed: {}", e.toText());
            return ToolResultHelper.createResult(FindFilesResponse.error(ToolResultHelper.errorPayload(e)));
        } catch (final IOException | RuntimeException e) {
            logger.error("Error finding files in {}", request.root(), e);
            return ToolResultHelper.createResult(FindFilesResponse.error(
                    ToolResultHelper.errorPayload("Error finding files: " + e.getMessage())));
        }
    }

    McpSchema.CallToolResult clearIndex(final Map<String, Object> args) {
        final RootRequest request = RootRequest.fromMap(args);
        logger.info("Clear index request: root='{}'", request.root());

        try {
            final LuceneIndexService indexService = indexServiceCache.get(requireRoot(request.root()));
            final boolean existed = indexService.clear();
            indexServiceCache.invalidate();
            return ToolResultHelper.createResult(ClearIndexResponse.success(indexService.getRoot().toString(),
                    indexService.getIndexPath().toString(), existed));
        } catch (final CodeIndexException e) {
            return ToolResultHelper.createResult(ClearIndexResponse.error(ToolResultHelper.errorPayload(e)));
        } catch (final IOException | RuntimeException e) {
            logger.error("Error clearing index for {}", request.root(), e);
            return ToolResultHelper.createResult(ClearIndexResponse.error(
                    ToolResultHelper.errorPayload("Error clearing index: " + e.getMessage())));
        }
    }

    McpSchema.CallToolResult listIndexedPaths(final Map<String, Object> args) {
        final RootRequest request = RootRequest.fromMap(args);

        try {
            final Path root = requireRoot(request.root());
            final List<String> paths = new ArrayList<>(indexServiceCache.get(root).getIndexedPaths());
            return ToolResultHelper.createResult(IndexedPathsResponse.success(root.toString(), paths));
        } catch (final CodeIndexException e) {
            return ToolResultHelper.createResult(IndexedPathsResponse.error(ToolResultHelper.errorPayload(e)));
        } catch (final IOException | RuntimeException e) {
            logger.error("Error listing indexed paths for {}", request.root(), e);
            return ToolResultHelper.createResult(IndexedPathsResponse.error(
                    ToolResultHelper.errorPayload("Error listing indexed paths: " + e.getMessage())));
        }
    }

    McpSchema.CallToolResult getIndexStats(final Map<String, Object> args) {
        final RootRequest request = RootRequest.fromMap(args);
        logger.info("Index stats request: root='{}'", request.root());

        try {
            final Path root = requireRoot(request.root());
            final LuceneIndexService indexService = indexServiceCache.get(root);
            final long documentCount = indexService.getDocumentCount();
            return ToolResultHelper.createResult(IndexStatsResponse.success(
                    indexService.getRoot().toString(),
                    indexService.getIndexPath().toString(),
                    documentCount,
                    indexService.getIndexedPaths().size(),
                    indexService.getSchemaVersion(),
                    indexService.isLocked(),
                    searchProvider.name(),
                    BuildInfo.getVersion(),
                    BuildInfo.getBuildTimestamp()));
        } catch (final CodeIndexException e) {
            return ToolResultHelper.createResult(IndexStatsResponse.error(ToolResultHelper.errorPayload(e)));
        } catch (final IOException | RuntimeException e) {
            logger.error("Error getting index stats", e);
            return ToolResultHelper.createResult(IndexStatsResponse.error(
                    ToolResultHelper.errorPayload("Error getting index stats: " + e.getMessage())));
        }
    }

    McpSchema.CallToolResult unlockIndex(final Map<String, Object> args) {
        final UnlockIndexRequest request = UnlockIndexRequest.fromMap(args);
        logger.info("Unlock index request: root='{}', confirm={}", request.root(), request.confirm());

        try {
            final Path root = requireRoot(request.root());
            if (!request.isConfirmed()) {
                throw new InputException(
                        "Operation not confirmed.",
                        "Removing the lock of an index that is being written can corrupt it.",
                        "Set confirm=true to proceed. Only use this if no other process is indexing this directory.");
            }

            final LuceneIndexService indexService = indexServiceCache.get(root);
            final String normalizedRoot = indexService.getRoot().toString();
            final String lockFilePath = indexService.getLockFilePath().toString();
            if (!indexService.isLockFilePresent()) {
                return ToolResultHelper.createResult(UnlockIndexResponse.noLockFile(normalizedRoot, lockFilePath));
            }
            final boolean writerActive = indexService.isLocked();
            if (writerActive) {
                logger.warn("Removing {} while a writer holds it", lockFilePath);
            }
            indexService.removeLockFile();
            indexServiceCache.invalidate();
            return ToolResultHelper.createResult(UnlockIndexResponse.removed(normalizedRoot, lockFilePath, writerActive));
        } catch (final CodeIndexException e) {
            logger.warn("Unlock refused: {}", e.toText());
            return ToolResultHelper.createResult(UnlockIndexResponse.error(ToolResultHelper.errorPayload(e)));
        } catch (final IOException | RuntimeException e) {
            logger.error("Error unlocking index", e);
            return ToolResultHelper.createResult(UnlockIndexResponse.error(
                    ToolResultHelper.errorPayload("Error unlocking index: " + e.getMessage())));
        }
    }

    static Path requireRoot(final @Nullable String root) throws InputException {
        if (root == null || root.isBlank()) {
            throw new InputException("Missing root directory.", "Every tool call needs the directory it works on.",
                    "Pass 'root' as an absolute path.");
        }
        return Path.of(root);
    }
}
