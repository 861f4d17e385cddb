package de.mirkosertic.skills.db;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Row access for the {@code prompts} table. Prompts are identified by their unique name.
 */
public class PromptRepository {

    private static final String INSERT_SQL = """
            INSERT INTO prompts (name, path, title, author, description, content,
                                 file_hash, size_bytes, token_count, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)""";

    private static final String UPDATE_SQL = """
            UPDATE prompts
               SET path = ?, title = ?, author = ?, description = ?, content = ?,
                   file_hash = ?, size_bytes = ?, token_count = ?, updated_at = ?
             WHERE name = ?""";

    private final SkillsDatabase database;

    public PromptRepository(final SkillsDatabase database) {
        this.database = database;
    }

    public Optional<PromptRecord> findByName(final String name) throws SQLException {
        try (final PreparedStatement ps = database.connection().prepareStatement(
                "SELECT * FROM prompts WHERE name = ?")) {
            ps.setString(1, name);
            try (final ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(PromptRecord.fromResultSet(rs)) : Optional.empty();
            }
        }
    }

    public List<PromptRecord> list(final int limit, final int offset) throws SQLException {
        try (final PreparedStatement ps = database.connection().prepareStatement(
                "SELECT * FROM prompts ORDER BY name LIMIT ? OFFSET ?")) {
            ps.setInt(1, limit);
            ps.setInt(2, offset);
            final List<PromptRecord> result = new ArrayList<>();
            try (final ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(PromptRecord.fromResultSet(rs));
                }
            }
            return result;
        }
    }

    /**
     * @return the generated id
     */
    public long insert(final PromptRecord prompt, final Instant now) throws SQLException {
        try (final PreparedStatement ps = database.connection().prepareStatement(INSERT_SQL)) {
            ps.setString(1, prompt.name());
            ps.setString(2, prompt.path());
            ps.setString(3, prompt.title());
            ps.setString(4, prompt.author());
            ps.setString(5, prompt.description());
            ps.setString(6, prompt.content());
            ps.setString(7, prompt.fileHash());
            ps.setLong(8, prompt.sizeBytes());
            ps.setInt(9, prompt.tokenCount());
            ps.setString(10, now.toString());
            ps.setString(11, now.toString());
            ps.executeUpdate();
        }
        try (final PreparedStatement ps = database.connection().prepareStatement("SELECT last_insert_rowid()");
             final ResultSet rs = ps.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        }
    }

    /**
     * Rewrite every mutable column of the prompt stored under {@code prompt.name()}.
     */
    public void update(final PromptRecord prompt, final Instant now) throws SQLException {
        try (final PreparedStatement ps = database.connection().prepareStatement(UPDATE_SQL)) {
            ps.setString(1, prompt.path());
            ps.setString(2, prompt.title());
            ps.setString(3, prompt.author());
            ps.setString(4, prompt.description());
            ps.setString(5, prompt.content());
            ps.setString(6, prompt.fileHash());
            ps.setLong(7, prompt.sizeBytes());
            ps.setInt(8, prompt.tokenCount());
            ps.setString(9, now.toString());
            ps.setString(10, prompt.name());
            ps.executeUpdate();
        }
    }
}
