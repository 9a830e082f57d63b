package de.mirkosertic.mcp.codeindex.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build time of the running server, read from the Maven filtered
 * {@code build-info.properties}. Placeholders that were not filtered (running from an IDE)
 * count as missing.
 */
public final class BuildInfo {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    static final String BUILD_INFO_FILE = "build-info.properties";
    static final String DEV_VERSION = "dev";
    static final String UNKNOWN_TIMESTAMP = "unknown";

    private static final String version;
    private static final String buildTimestamp;

    static {
        final Properties props = new Properties();
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(BUILD_INFO_FILE)) {
            if (input != null) {
                props.load(input);
            } else {
                logger.debug("{} not on classpath, running in dev mode", BUILD_INFO_FILE);
            }
        } catch (final IOException e) {
            logger.warn("Failed to load {}", BUILD_INFO_FILE, e);
        }
        version = filtered(props.getProperty("build.version"), DEV_VERSION);
        buildTimestamp = filtered(props.getProperty("build.timestamp"), UNKNOWN_TIMESTAMP);
    }

    private BuildInfo() {
    }

    static String filtered(final String value, final String fallback) {
        if (value == null || value.isBlank() || value.startsWith("${")) {
            return fallback;
        }
        return value;
    }

    public static String getVersion() {
        return version;
    }

    public static String getBuildTimestamp() {
        return buildTimestamp;
    }
}
