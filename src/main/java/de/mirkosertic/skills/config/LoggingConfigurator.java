package de.mirkosertic.skills.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configures Logback for a CLI invocation.
 * <p>
 * By default logback.xml is used: warnings and errors go to stderr so that stdout only
 * carries command output. With {@code SKILLS_LOG_TO_FILE=true} logback-file.xml is loaded
 * instead, which writes everything to {@code ~/.config/skills-indexer/log}.
 */
public final class LoggingConfigurator {

    public static final String ENV_LOG_TO_FILE = "SKILLS_LOG_TO_FILE";
    private static final String FILE_CONFIG = "logback-file.xml";
    private static final String APPLICATION_LOGGER = "de.mirkosertic.skills";

    private LoggingConfigurator() {
    }

    /**
     * Must be called before the first log statement of the process.
     */
    public static void configure(final boolean logToFile) {
        if (logToFile) {
            ensureLogDirectoryExists();
            loadConfiguration(FILE_CONFIG);
        }
    }

    /**
     * Raise the application logger to DEBUG, used by {@code --verbose}.
     */
    public static void enableVerbose() {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.getLogger(APPLICATION_LOGGER).setLevel(Level.DEBUG);
    }

    static Path logDirectory() {
        return Paths.get(System.getProperty("user.home"), ".config", "skills-indexer", "log");
    }

    private static void ensureLogDirectoryExists() {
        final Path logDir = logDirectory();
        try {
            Files.createDirectories(logDir);
        } catch (final Exception e) {
            System.err.println("Warning: Could not create log directory: " + logDir);
        }
    }

    private static void loadConfiguration(final String configFile) {
        try {
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            context.reset();
            context.putProperty("LOG_DIR", logDirectory().toString());

            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);

            try (InputStream configStream = LoggingConfigurator.class.getClassLoader()
                    .getResourceAsStream(configFile)) {
                if (configStream != null) {
                    configurator.doConfigure(configStream);
                } else {
                    System.err.println("Warning: Could not find " + configFile + " on classpath");
                }
            }
        } catch (final JoranException e) {
            System.err.println("Warning: Error loading logback configuration: " + e.getMessage());
        } catch (final Exception e) {
            System.err.println("Warning: Unexpected error configuring logging: " + e.getMessage());
        }
    }
}
