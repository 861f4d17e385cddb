package de.mirkosertic.skills.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Owns the single SQLite connection of a CLI invocation.
 * <p>
 * The connection runs in auto-commit mode, so every row write outside of
 * {@link #inTransaction(SqlWork)} is committed on its own.
 */
public class SkillsDatabase implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SkillsDatabase.class);

    /**
     * A unit of work executed against the open connection.
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T execute(Connection connection) throws SQLException;
    }

    private final Path databasePath;
    private Connection connection;

    public SkillsDatabase(final Path databasePath) {
        this.databasePath = databasePath;
    }

    /**
     * Open the database, creating the parent directory and the file if necessary.
     */
    public void open() throws IOException, SQLException {
        final Path parent = databasePath.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
            logger.info("Created database directory: {}", parent);
        }

        connection = DriverManager.getConnection("jdbc:sqlite:" + databasePath.toAbsolutePath());
        try (final Statement st = connection.createStatement()) {
            st.execute("PRAGMA foreign_keys = ON");
        }
        logger.debug("Opened database at {}", databasePath.toAbsolutePath());
    }

    public Connection connection() {
        if (connection == null) {
            throw new IllegalStateException("Database is not open: " + databasePath);
        }
        return connection;
    }

    public Path getDatabasePath() {
        return databasePath;
    }

    /**
     * Run the given work in a single transaction. The transaction is rolled back if the
     * work throws.
     */
    public <T> T inTransaction(final SqlWork<T> work) throws SQLException {
        final Connection conn = connection();
        final boolean previousAutoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try {
            final T result = work.execute(conn);
            conn.commit();
            return result;
        } catch (final SQLException | RuntimeException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(previousAutoCommit);
        }
    }

    @Override
    public void close() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
            logger.debug("Closed database at {}", databasePath.toAbsolutePath());
        } catch (final SQLException e) {
            logger.error("Error closing database {}", databasePath, e);
        } finally {
            connection = null;
        }
    }
}
