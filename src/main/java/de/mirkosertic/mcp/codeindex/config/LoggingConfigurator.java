package de.mirkosertic.mcp.codeindex.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Switches Logback to the file based configuration when running deployed.
 * <p>
 * Development runs keep {@code logback.xml}, which logs to stderr. Deployed runs load
 * {@code logback-deployed.xml} and write to {@code ~/.mcpcodeindex/log} so that nothing but
 * JSON-RPC ever reaches stdout.
 */
public final class LoggingConfigurator {

    static final Path LOG_DIR = Path.of(System.getProperty("user.home"), ".mcpcodeindex", "log");
    static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must run before the first logger is obtained.
     */
    public static void configure(final boolean deployedMode) {
        if (!deployedMode) {
            return;
        }
        try {
            Files.createDirectories(LOG_DIR);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory " + LOG_DIR + ": " + e.getMessage());
        }
        loadConfiguration(DEPLOYED_CONFIG);
    }

    private static void loadConfiguration(final String configFile) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try (final InputStream configStream = LoggingConfigurator.class.getClassLoader().getResourceAsStream(configFile)) {
            if (configStream == null) {
                System.err.println("Warning: " + configFile + " not found on classpath");
                return;
            }
            context.reset();
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(configStream);
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Could not load " + configFile + ": " + e.getMessage());
        }
    }
}
