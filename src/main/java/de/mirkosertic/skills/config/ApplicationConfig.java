package de.mirkosertic.skills.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Central configuration for the skills indexer.
 * <p>
 * The configuration is the deep merge of an ordered list of partial sources,
 * each layer overriding the keys present in the previous ones:
 * <ol>
 *   <li>Application defaults ({@code application.yaml} in the classpath)</li>
 *   <li>Global user config ({@code $XDG_CONFIG_HOME/skills-indexer/config.yaml})</li>
 *   <li>Project config ({@code .skills-indexer.yaml} in the working directory)</li>
 *   <li>Environment variables</li>
 * </ol>
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    public static final String ENV_DB_PATH = "SKILLS_DB_PATH";
    public static final String ENV_PROJECT_ROOT = "SKILLS_PROJECT_ROOT";
    public static final String ENV_OUTPUT_FORMAT = "SKILLS_OUTPUT_FORMAT";
    private static final String ENV_XDG_CONFIG_HOME = "XDG_CONFIG_HOME";

    private static final String CONFIG_DIR = "skills-indexer";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String PROJECT_CONFIG_FILE = ".skills-indexer.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    private static final int FALLBACK_MAX_RESULTS = 50;

    private final Map<String, Object> values;
    private final Map<String, String> environment;
    private final Path workingDirectory;

    private ApplicationConfig(final Map<String, Object> values, final Map<String, String> environment,
                              final Path workingDirectory) {
        this.values = values;
        this.environment = environment;
        this.workingDirectory = workingDirectory;
    }

    /**
     * Load configuration from all sources of the current process.
     */
    public static ApplicationConfig load() {
        return load(System.getenv(), Paths.get(System.getProperty("user.dir")));
    }

    /**
     * Load configuration for an explicit environment and working directory.
     */
    public static ApplicationConfig load(final Map<String, String> environment, final Path workingDirectory) {
        final List<Map<String, Object>> layers = new ArrayList<>();
        layers.add(loadFromClasspath());
        layers.add(loadFromFile(getUserConfigPath(environment)));
        layers.add(loadFromFile(workingDirectory.resolve(PROJECT_CONFIG_FILE)));
        layers.add(environmentOverrides(environment));

        final ApplicationConfig config = new ApplicationConfig(fold(layers), environment, workingDirectory);

        logger.debug("Configuration loaded: databasePath={}, projectRoot={}, outputFormat={}",
                config.getDatabasePath(), config.getProjectRoot(), config.getOutputFormat());

        return config;
    }

    /**
     * Application defaults with the given overrides merged on top. Environment and user
     * config files are not consulted.
     */
    public static ApplicationConfig withOverrides(final Map<String, Object> overrides, final Path workingDirectory) {
        final List<Map<String, Object>> layers = List.of(loadFromClasspath(), overrides);
        return new ApplicationConfig(fold(layers), Map.of(), workingDirectory);
    }

    static Map<String, Object> fold(final List<Map<String, Object>> layers) {
        Map<String, Object> merged = new LinkedHashMap<>();
        for (final Map<String, Object> layer : layers) {
            merged = deepMerge(merged, layer);
        }
        return merged;
    }

    /**
     * Recursively merge {@code override} into {@code base}. Nested maps are merged,
     * every other value in {@code override} replaces the one in {@code base}.
     * Neither argument is modified.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> deepMerge(final Map<String, Object> base, final Map<String, Object> override) {
        final Map<String, Object> result = new LinkedHashMap<>(base);
        if (override == null) {
            return result;
        }
        for (final Map.Entry<String, Object> entry : override.entrySet()) {
            final Object existing = result.get(entry.getKey());
            final Object value = entry.getValue();
            if (existing instanceof Map && value instanceof Map) {
                result.put(entry.getKey(), deepMerge((Map<String, Object>) existing, (Map<String, Object>) value));
            } else {
                result.put(entry.getKey(), value);
            }
        }
        return result;
    }

    private static Map<String, Object> loadFromClasspath() {
        try (final InputStream is = ApplicationConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                    return config;
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
        return Map.of();
    }

    private static Map<String, Object> loadFromFile(final Path path) {
        if (!Files.isRegularFile(path)) {
            return Map.of();
        }
        try (final Reader reader = Files.newBufferedReader(path)) {
            final Object config = new Yaml().load(reader);
            if (config instanceof Map) {
                logger.debug("Loaded config from: {}", path);
                @SuppressWarnings("unchecked") final Map<String, Object> map = (Map<String, Object>) config;
                return map;
            }
            logger.warn("Ignoring config file without a top-level mapping: {}", path);
        } catch (final IOException e) {
            logger.warn("Failed to load config from: {}", path, e);
        } catch (final RuntimeException e) {
            logger.warn("Failed to parse config file: {}", path, e);
        }
        return Map.of();
    }

    private static Map<String, Object> environmentOverrides(final Map<String, String> environment) {
        final Map<String, Object> overrides = new LinkedHashMap<>();
        final String dbPath = trimmedOrNull(environment.get(ENV_DB_PATH));
        if (dbPath != null) {
            overrides.put("database", Map.of("path", dbPath));
            logger.debug("Database path from environment: {}", dbPath);
        }
        final String projectRoot = trimmedOrNull(environment.get(ENV_PROJECT_ROOT));
        if (projectRoot != null) {
            overrides.put("project", Map.of("root", projectRoot));
            logger.debug("Project root from environment: {}", projectRoot);
        }
        final String outputFormat = trimmedOrNull(environment.get(ENV_OUTPUT_FORMAT));
        if (outputFormat != null) {
            overrides.put("output", Map.of("format", outputFormat));
        }
        return overrides;
    }

    private static String trimmedOrNull(final String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }

    public static Path getUserConfigPath(final Map<String, String> environment) {
        return getConfigDirectory(environment).resolve(USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory(final Map<String, String> environment) {
        final String xdgConfigHome = trimmedOrNull(environment.get(ENV_XDG_CONFIG_HOME));
        final Path base = xdgConfigHome != null
                ? Paths.get(xdgConfigHome)
                : Paths.get(System.getProperty("user.home"), ".config");
        return base.resolve(CONFIG_DIR);
    }

    /**
     * Write the application defaults to the user config file unless it already exists.
     *
     * @return true if a new file was written
     */
    public boolean writeDefaultUserConfig() throws IOException {
        final Path configPath = getUserConfigPath(environment);
        if (Files.exists(configPath)) {
            return false;
        }
        Files.createDirectories(configPath.getParent());

        final DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);
        try (final Writer writer = Files.newBufferedWriter(configPath)) {
            new Yaml(options).dump(new LinkedHashMap<>(loadFromClasspath()), writer);
        }
        logger.info("Wrote default configuration to {}", configPath);
        return true;
    }

    /**
     * Resolve variables in strings like ${VAR:default}, then expand a leading ~.
     */
    String resolveVariables(final String value) {
        if (value == null) {
            return null;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            String replacement = environment.get(parts[0]);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(parts[0], defaultValue);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        if (result.startsWith("~")) {
            result = System.getProperty("user.home") + result.substring(1);
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private Object lookup(final String dottedKey) {
        Object current = values;
        for (final String part : dottedKey.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<String, Object>) current).get(part);
        }
        return current;
    }

    private String getString(final String dottedKey, final String defaultValue) {
        final Object value = lookup(dottedKey);
        return value == null ? defaultValue : resolveVariables(value.toString());
    }

    // Getters
    public Path getDatabasePath() {
        final String path = getString("database.path", null);
        if (path == null || path.isEmpty()) {
            return getConfigDirectory(environment).resolve("skills.db");
        }
        return Paths.get(path);
    }

    public boolean isAutoMigrate() {
        final Object value = lookup("database.auto-migrate");
        return value == null || Boolean.parseBoolean(value.toString());
    }

    public Path getProjectRoot() {
        final String root = getString("project.root", null);
        if (root == null || root.isEmpty()) {
            return workingDirectory.toAbsolutePath();
        }
        return Paths.get(root).toAbsolutePath();
    }

    public Path getSkillsDirectory() {
        return getProjectRoot().resolve(getString("project.skills-dir", "skills"));
    }

    public Path getPromptsDirectory() {
        return getProjectRoot().resolve(getString("project.prompts-dir", "prompts"));
    }

    public Path getPromptConfigsDirectory() {
        return getProjectRoot().resolve(getString("project.prompt-configs-dir", "prompt_configs"));
    }

    public int getMaxResults() {
        final Object value = lookup("search.max-results");
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (final NumberFormatException e) {
                logger.warn("Invalid search.max-results '{}', using {}", value, FALLBACK_MAX_RESULTS);
            }
        }
        return FALLBACK_MAX_RESULTS;
    }

    /**
     * The configured output format, or null when none is configured.
     */
    public String getOutputFormat() {
        return getString("output.format", null);
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }
}
