package de.mirkosertic.skills.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

public enum OutputFormat {
    JSON,
    HUMAN;

    private static final Logger logger = LoggerFactory.getLogger(OutputFormat.class);

    /**
     * Pick the output format. {@code --json} wins over {@code --human}, which wins over the
     * configured format. Without any of them the output is JSON.
     */
    public static OutputFormat resolve(final boolean jsonFlag, final boolean humanFlag, final String configured) {
        if (jsonFlag) {
            return JSON;
        }
        if (humanFlag) {
            return HUMAN;
        }
        if (configured == null || configured.isBlank()) {
            return JSON;
        }
        try {
            return valueOf(configured.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            logger.warn("Unknown output format '{}' in configuration, using json", configured);
            return JSON;
        }
    }
}
