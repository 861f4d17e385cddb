package de.mirkosertic.skills.db;

import com.google.common.io.Resources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Applies the ordered set of schema migrations found under {@code db/migrations} in the classpath.
 * <p>
 * Each migration has an {@code .up.sql} and a {@code .down.sql} script whose statements are
 * separated by {@code --;;} lines. Applied versions are recorded in {@code schema_version}, so
 * running {@link #migrate()} repeatedly only applies what is pending.
 */
public class SchemaMigrator {

    private static final Logger logger = LoggerFactory.getLogger(SchemaMigrator.class);

    private static final String MIGRATIONS_LOCATION = "db/migrations/";
    private static final String STATEMENT_SEPARATOR = "(?m)^--;;\\s*$";

    /**
     * A single migration step.
     */
    public record Migration(int version, String name) {

        String resourceName(final String direction) {
            return MIGRATIONS_LOCATION + String.format("%03d-%s.%s.sql", version, name, direction);
        }
    }

    /**
     * All migrations, in application order. Add new entries at the end only.
     */
    public static final List<Migration> MIGRATIONS = List.of(
            new Migration(1, "skills-and-prompts"),
            new Migration(2, "prompt-fragments")
    );

    private final SkillsDatabase database;

    public SchemaMigrator(final SkillsDatabase database) {
        this.database = database;
    }

    /**
     * Apply all pending migrations.
     *
     * @return the number of migrations applied
     */
    public int migrate() throws SQLException {
        ensureVersionTable();
        final int current = getCurrentVersion();
        int applied = 0;
        for (final Migration migration : MIGRATIONS) {
            if (migration.version() > current) {
                apply(migration);
                applied++;
            }
        }
        if (applied == 0) {
            logger.debug("Database schema is up to date at version {}", current);
        } else {
            logger.info("Applied {} migration(s), schema is now at version {}", applied, getCurrentVersion());
        }
        return applied;
    }

    /**
     * Roll back every applied migration and apply all of them again. All data is lost.
     */
    public void reset() throws SQLException {
        ensureVersionTable();
        final int current = getCurrentVersion();
        logger.warn("Resetting database schema from version {}", current);

        final List<Migration> reversed = new ArrayList<>(MIGRATIONS);
        Collections.reverse(reversed);

        database.inTransaction(conn -> {
            for (final Migration migration : reversed) {
                if (migration.version() <= current) {
                    executeScript(conn, loadScript(migration.resourceName("down")));
                }
            }
            try (final Statement st = conn.createStatement()) {
                st.executeUpdate("DELETE FROM schema_version");
            }
            return null;
        });

        migrate();
    }

    public int getCurrentVersion() throws SQLException {
        ensureVersionTable();
        try (final Statement st = database.connection().createStatement();
             final ResultSet rs = st.executeQuery("SELECT COALESCE(MAX(version), 0) FROM schema_version")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    public static int latestVersion() {
        return MIGRATIONS.get(MIGRATIONS.size() - 1).version();
    }

    private void ensureVersionTable() throws SQLException {
        try (final Statement st = database.connection().createStatement()) {
            st.execute("CREATE TABLE IF NOT EXISTS schema_version ("
                    + "version INTEGER PRIMARY KEY, "
                    + "name TEXT NOT NULL, "
                    + "applied_at TEXT NOT NULL)");
        }
    }

    private void apply(final Migration migration) throws SQLException {
        logger.info("Applying migration {} ({})", migration.version(), migration.name());
        final String script = loadScript(migration.resourceName("up"));
        database.inTransaction(conn -> {
            executeScript(conn, script);
            try (final PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO schema_version (version, name, applied_at) VALUES (?, ?, ?)")) {
                ps.setInt(1, migration.version());
                ps.setString(2, migration.name());
                ps.setString(3, Instant.now().toString());
                ps.executeUpdate();
            }
            return null;
        });
    }

    static List<String> splitStatements(final String script) {
        final List<String> statements = new ArrayList<>();
        for (final String part : script.split(STATEMENT_SEPARATOR)) {
            final String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                statements.add(trimmed);
            }
        }
        return statements;
    }

    private static void executeScript(final Connection conn, final String script) throws SQLException {
        try (final Statement st = conn.createStatement()) {
            for (final String statement : splitStatements(script)) {
                st.execute(statement);
            }
        }
    }

    private static String loadScript(final String resourceName) {
        try {
            final URL url = Resources.getResource(resourceName);
            return Resources.toString(url, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot read migration script " + resourceName, e);
        }
    }
}
