package de.mirkosertic.mcp.codeindex.config;

import de.mirkosertic.mcp.codeindex.error.InputException;
import de.mirkosertic.mcp.codeindex.index.IndexConfig;
import de.mirkosertic.mcp.codeindex.walker.BinaryPolicy;
import de.mirkosertic.mcp.codeindex.walker.WalkOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Central configuration for the MCP Code Index server.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.mcpcodeindex/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    static final String ENV_INDEX_DIR = "CODEINDEX_INDEX_DIR";
    static final String ENV_HEAP_SIZE_MB = "CODEINDEX_HEAP_SIZE_MB";
    static final String ENV_SEARCH_PROVIDER = "CODEINDEX_SEARCH_PROVIDER";
    static final String PROP_INDEX_DIR = "codeindex.index.dir";
    private static final String CONFIG_DIR = ".mcpcodeindex";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    static final int DEFAULT_SEARCH_LIMIT = 20;

    // Index settings
    private Path indexDirectory = IndexConfig.defaultIndexDirectory();
    private int heapSizeMb = IndexConfig.DEFAULT_HEAP_SIZE_MB;
    private boolean replaceChangedDocuments = false;
    private Map<String, Double> boosts = IndexConfig.defaultBoosts();

    // Search settings
    private String searchProvider = "auto";
    private int defaultSearchLimit = DEFAULT_SEARCH_LIMIT;

    // Walk settings
    private final WalkOptions.Builder walkDefaults = WalkOptions.builder()
            .extensions(List.of(".py", ".ts", ".js", ".jsx", ".tsx", ".java", ".go", ".rs", ".cpp", ".c", ".h",
                    ".md", ".txt", ".json", ".yaml", ".yml", ".toml"))
            .maxFileBytes(1_000_000L)
            .maxTotalBytes(50_000_000L)
            .excludeLockfiles(true);

    // Profile settings
    private boolean deployedMode = false;

    ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        return load(System::getenv);
    }

    static ApplicationConfig load(final Function<String, String> environment) {
        final ApplicationConfig config = new ApplicationConfig();
        config.loadFromClasspath();
        config.loadFromUserConfig();
        config.applyOverrides(environment);
        config.determineProfile();

        logger.info("Configuration loaded: indexDirectory={}, searchProvider={}, replaceChangedDocuments={}, deployedMode={}",
                config.indexDirectory, config.searchProvider, config.replaceChangedDocuments, config.deployedMode);
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Map<String, Object> yaml = new Yaml().load(is);
                if (yaml != null) {
                    applyYamlConfig(yaml);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (!Files.exists(userConfigPath)) {
            return;
        }
        try (final InputStream is = Files.newInputStream(userConfigPath)) {
            final Map<String, Object> yaml = new Yaml().load(is);
            if (yaml != null) {
                applyYamlConfig(yaml);
                logger.debug("Loaded user config from: {}", userConfigPath);
            }
        } catch (final IOException | RuntimeException e) {
            logger.warn("Failed to load user config from: {}", userConfigPath, e);
        }
    }

    @SuppressWarnings("unchecked")
    void applyYamlConfig(final Map<String, Object> yaml) {
        final Map<String, Object> root = (Map<String, Object>) yaml.get("codeindex");
        if (root == null) {
            return;
        }

        final Map<String, Object> index = (Map<String, Object>) root.get("index");
        if (index != null) {
            applyIndexConfig(index);
        }

        final Map<String, Object> search = (Map<String, Object>) root.get("search");
        if (search != null) {
            if (search.get("provider") != null) {
                this.searchProvider = resolveVariables(search.get("provider").toString());
            }
            if (search.containsKey("default-limit")) {
                this.defaultSearchLimit = ((Number) search.get("default-limit")).intValue();
            }
        }

        final Map<String, Object> walk = (Map<String, Object>) root.get("walk");
        if (walk != null) {
            applyWalkConfig(walk);
        }
    }

    @SuppressWarnings("unchecked")
    private void applyIndexConfig(final Map<String, Object> index) {
        if (index.get("directory") != null) {
            this.indexDirectory = Path.of(resolveVariables(index.get("directory").toString()));
        }
        if (index.containsKey("heap-size-mb")) {
            this.heapSizeMb = ((Number) index.get("heap-size-mb")).intValue();
        }
        if (index.containsKey("replace-changed-documents")) {
            this.replaceChangedDocuments = (Boolean) index.get("replace-changed-documents");
        }
        if (index.get("boosts") instanceof Map) {
            final Map<String, Double> configured = new LinkedHashMap<>();
            for (final Map.Entry<String, Object> entry : ((Map<String, Object>) index.get("boosts")).entrySet()) {
                if (entry.getValue() instanceof Number weight) {
                    configured.put(entry.getKey(), weight.doubleValue());
                } else {
                    logger.warn("Ignoring index.boosts.{}: '{}' is not a number", entry.getKey(), entry.getValue());
                }
            }
            this.boosts = configured;
        }
    }

    @SuppressWarnings("unchecked")
    private void applyWalkConfig(final Map<String, Object> walk) {
        if (walk.containsKey("extensions")) {
            final Object extensions = walk.get("extensions");
            walkDefaults.extensions(extensions instanceof List ? new ArrayList<>((List<String>) extensions) : null);
        }
        if (walk.get("include-globs") instanceof List) {
            walkDefaults.includeGlobs(new ArrayList<>((List<String>) walk.get("include-globs")));
        }
        if (walk.get("exclude-globs") instanceof List) {
            walkDefaults.excludeGlobs(new ArrayList<>((List<String>) walk.get("exclude-globs")));
        }
        if (walk.containsKey("respect-gitignore")) {
            walkDefaults.respectGitignore((Boolean) walk.get("respect-gitignore"));
        }
        if (walk.containsKey("include-hidden")) {
            walkDefaults.includeHidden((Boolean) walk.get("include-hidden"));
        }
        if (walk.containsKey("follow-symlinks")) {
            walkDefaults.followSymlinks((Boolean) walk.get("follow-symlinks"));
        }
        if (walk.containsKey("max-file-bytes")) {
            walkDefaults.maxFileBytes(toLong(walk.get("max-file-bytes")));
        }
        if (walk.containsKey("max-total-bytes")) {
            walkDefaults.maxTotalBytes(toLong(walk.get("max-total-bytes")));
        }
        if (walk.containsKey("exclude-lockfiles")) {
            walkDefaults.excludeLockfiles((Boolean) walk.get("exclude-lockfiles"));
        }
        if (walk.get("binary-policy") != null) {
            try {
                walkDefaults.binaryPolicy(BinaryPolicy.parse(walk.get("binary-policy").toString()));
            } catch (final InputException e) {
                logger.warn("Ignoring walk.binary-policy: {}", e.getMessage());
            }
        }
        if (walk.get("encoding") != null) {
            final String encoding = walk.get("encoding").toString();
            try {
                walkDefaults.encoding(Charset.forName(encoding));
            } catch (final IllegalCharsetNameException | UnsupportedCharsetException e) {
                logger.warn("Ignoring unknown walk.encoding '{}'", encoding);
            }
        }
    }

    private static Long toLong(final Object value) {
        return value == null ? null : ((Number) value).longValue();
    }

    void applyOverrides(final Function<String, String> environment) {
        final String propIndexDir = System.getProperty(PROP_INDEX_DIR);
        if (propIndexDir != null && !propIndexDir.isBlank()) {
            this.indexDirectory = Path.of(propIndexDir.trim());
        }

        final String envIndexDir = environment.apply(ENV_INDEX_DIR);
        if (envIndexDir != null && !envIndexDir.isBlank()) {
            this.indexDirectory = Path.of(envIndexDir.trim());
            logger.info("Index directory from environment: {}", this.indexDirectory);
        }

        final String envHeap = environment.apply(ENV_HEAP_SIZE_MB);
        if (envHeap != null && !envHeap.isBlank()) {
            try {
                this.heapSizeMb = Integer.parseInt(envHeap.trim());
            } catch (final NumberFormatException e) {
                logger.warn("Ignoring {}='{}', not a number", ENV_HEAP_SIZE_MB, envHeap);
            }
        }

        final String envProvider = environment.apply(ENV_SEARCH_PROVIDER);
        if (envProvider != null && !envProvider.isBlank()) {
            this.searchProvider = envProvider.trim();
        }
    }

    private void determineProfile() {
        final String profile = System.getProperty("profile", "default");
        this.deployedMode = "deployed".equalsIgnoreCase(profile);
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String[] parts = result.substring(start + 2, end).split(":", 2);
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            String replacement = System.getenv(parts[0]);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(parts[0], defaultValue);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Path.of(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public IndexConfig getIndexConfig() {
        return new IndexConfig(indexDirectory, heapSizeMb, boosts, replaceChangedDocuments);
    }

    public WalkOptions getWalkDefaults() {
        return walkDefaults.build();
    }

    public Path getIndexDirectory() {
        return indexDirectory;
    }

    public int getHeapSizeMb() {
        return heapSizeMb;
    }

    public boolean isReplaceChangedDocuments() {
        return replaceChangedDocuments;
    }

    public Map<String, Double> getBoosts() {
        return boosts;
    }

    public String getSearchProvider() {
        return searchProvider;
    }

    public int getDefaultSearchLimit() {
        return defaultSearchLimit;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
