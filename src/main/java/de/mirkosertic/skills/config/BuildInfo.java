package de.mirkosertic.skills.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version information from the Maven-filtered build-info.properties, also used as the
 * picocli version provider for {@code --version}.
 * Falls back to "dev"/"unknown" when the file is missing or still unfiltered.
 */
public final class BuildInfo implements CommandLine.IVersionProvider {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final String BUILD_INFO_FILE = "build-info.properties";

    private static final Properties PROPERTIES = loadProperties();

    private static Properties loadProperties() {
        final Properties props = new Properties();
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(BUILD_INFO_FILE)) {
            if (input != null) {
                props.load(input);
            }
        } catch (final IOException e) {
            logger.warn("Failed to load build info, using defaults", e);
        }
        return props;
    }

    private static String property(final String key, final String fallback) {
        final String value = PROPERTIES.getProperty(key);
        if (value == null || value.isBlank() || value.startsWith("${")) {
            return fallback;
        }
        return value;
    }

    public static String version() {
        return property("build.version", "dev");
    }

    public static String buildTimestamp() {
        return property("build.timestamp", "unknown");
    }

    @Override
    public String[] getVersion() {
        return new String[]{"skills-indexer " + version() + " (built " + buildTimestamp() + ")"};
    }
}
