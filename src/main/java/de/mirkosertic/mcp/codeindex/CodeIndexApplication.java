package de.mirkosertic.mcp.codeindex;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.codeindex.config.ApplicationConfig;
import de.mirkosertic.mcp.codeindex.config.BuildInfo;
import de.mirkosertic.mcp.codeindex.config.LoggingConfigurator;
import de.mirkosertic.mcp.codeindex.error.IndexException;
import de.mirkosertic.mcp.codeindex.index.IndexServiceCache;
import de.mirkosertic.mcp.codeindex.mcp.LatestProtocolStdioServerTransportProvider;
import de.mirkosertic.mcp.codeindex.search.SearchProvider;
import de.mirkosertic.mcp.codeindex.search.SearchProviders;
import de.mirkosertic.mcp.codeindex.walker.DirectoryWalker;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the MCP Code Index server.
 * Wires the services and serves the tools over STDIO.
 */
public class CodeIndexApplication {

    private static final Logger logger = LoggerFactory.getLogger(CodeIndexApplication.class);

    private final IndexServiceCache indexServiceCache;
    private final CodeIndexTools tools;
    private McpSyncServer mcpServer;

    public CodeIndexApplication(final ApplicationConfig config) throws IndexException {
        this.indexServiceCache = new IndexServiceCache(config.getIndexConfig());
        final SearchProvider searchProvider = SearchProviders.select(config.getSearchProvider(), indexServiceCache);
        logger.info("Using search provider '{}'", searchProvider.name());
        this.tools = new CodeIndexTools(config, indexServiceCache, searchProvider, new DirectoryWalker());
    }

    /**
     * Start the MCP server and block until the process is terminated.
     */
    public void start() {
        logger.info("Starting MCP server with STDIO transport...");

        final McpSchema.ServerCapabilities capabilities = McpSchema.ServerCapabilities.builder()
                .tools(true)
                .build();

        final McpSchema.Implementation serverInfo = new McpSchema.Implementation(
                "MCP Code Index",
                BuildInfo.getVersion()
        );

        final LatestProtocolStdioServerTransportProvider transportProvider =
                new LatestProtocolStdioServerTransportProvider(new JacksonMcpJsonMapper(new ObjectMapper()));

        mcpServer = McpServer.sync(transportProvider)
                .serverInfo(serverInfo)
                .capabilities(capabilities)
                .tools(tools.getToolSpecifications())
                .build();

        logger.info("MCP server started, version {} built {}", BuildInfo.getVersion(), BuildInfo.getBuildTimestamp());

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

        // The STDIO transport runs on its own threads
        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }
    }

    public void shutdown() {
        logger.info("Shutting down MCP Code Index...");
        try {
            if (mcpServer != null) {
                mcpServer.close();
            }
        } catch (final Exception e) {
            logger.error("Error closing MCP server", e);
        }
        indexServiceCache.close();
        logger.info("MCP Code Index shutdown complete");
    }

    public static void main(final String[] args) {
        try {
            // Logging first, stdout belongs to JSON-RPC
            final boolean deployedMode = "deployed".equalsIgnoreCase(System.getProperty("profile"));
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();
            if (!deployedMode) {
                logger.info("Running in development mode, index directory {}", config.getIndexDirectory());
            }

            new CodeIndexApplication(config).start();
        } catch (final Exception e) {
            System.err.println("Failed to start MCP Code Index: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
