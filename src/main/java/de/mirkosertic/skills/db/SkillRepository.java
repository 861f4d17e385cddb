package de.mirkosertic.skills.db;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Row access for the {@code skills} table. Skills are identified by their path.
 */
public class SkillRepository {

    private static final String INSERT_SQL = """
            INSERT INTO skills (path, category, name, title, description, content,
                                file_hash, size_bytes, token_count, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)""";

    private static final String UPDATE_SQL = """
            UPDATE skills
               SET category = ?, name = ?, title = ?, description = ?, content = ?,
                   file_hash = ?, size_bytes = ?, token_count = ?, updated_at = ?
             WHERE path = ?""";

    private final SkillsDatabase database;

    public SkillRepository(final SkillsDatabase database) {
        this.database = database;
    }

    public Optional<SkillRecord> findByPath(final String path) throws SQLException {
        try (final PreparedStatement ps = database.connection().prepareStatement(
                "SELECT * FROM skills WHERE path = ?")) {
            ps.setString(1, path);
            return single(ps);
        }
    }

    /**
     * Find a skill by name, optionally restricted to a category. When several skills share
     * the name the one with the lowest id wins.
     */
    public Optional<SkillRecord> findByName(final String name, final String category) throws SQLException {
        final String sql = category == null
                ? "SELECT * FROM skills WHERE name = ? ORDER BY id LIMIT 1"
                : "SELECT * FROM skills WHERE name = ? AND category = ? ORDER BY id LIMIT 1";
        try (final PreparedStatement ps = database.connection().prepareStatement(sql)) {
            ps.setString(1, name);
            if (category != null) {
                ps.setString(2, category);
            }
            return single(ps);
        }
    }

    /**
     * List skills ordered by category and name.
     */
    public List<SkillRecord> list(final String category, final int limit, final int offset) throws SQLException {
        final String sql = category == null
                ? "SELECT * FROM skills ORDER BY category, name LIMIT ? OFFSET ?"
                : "SELECT * FROM skills WHERE category = ? ORDER BY category, name LIMIT ? OFFSET ?";
        try (final PreparedStatement ps = database.connection().prepareStatement(sql)) {
            int index = 1;
            if (category != null) {
                ps.setString(index++, category);
            }
            ps.setInt(index++, limit);
            ps.setInt(index, offset);
            final List<SkillRecord> result = new ArrayList<>();
            try (final ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(SkillRecord.fromResultSet(rs));
                }
            }
            return result;
        }
    }

    /**
     * Insert a new skill with both timestamps set to {@code now}.
     *
     * @return the generated id
     */
    public long insert(final SkillRecord skill, final Instant now) throws SQLException {
        try (final PreparedStatement ps = database.connection().prepareStatement(INSERT_SQL)) {
            ps.setString(1, skill.path());
            ps.setString(2, skill.category());
            ps.setString(3, skill.name());
            ps.setString(4, skill.title());
            ps.setString(5, skill.description());
            ps.setString(6, skill.content());
            ps.setString(7, skill.fileHash());
            ps.setLong(8, skill.sizeBytes());
            ps.setInt(9, skill.tokenCount());
            ps.setString(10, now.toString());
            ps.setString(11, now.toString());
            ps.executeUpdate();
        }
        return lastInsertId();
    }

    /**
     * Rewrite every mutable column of the skill stored under {@code skill.path()}.
     * The path and {@code created_at} are left untouched.
     */
    public void update(final SkillRecord skill, final Instant now) throws SQLException {
        try (final PreparedStatement ps = database.connection().prepareStatement(UPDATE_SQL)) {
            ps.setString(1, skill.category());
            ps.setString(2, skill.name());
            ps.setString(3, skill.title());
            ps.setString(4, skill.description());
            ps.setString(5, skill.content());
            ps.setString(6, skill.fileHash());
            ps.setLong(7, skill.sizeBytes());
            ps.setInt(8, skill.tokenCount());
            ps.setString(9, now.toString());
            ps.setString(10, skill.path());
            ps.executeUpdate();
        }
    }

    private long lastInsertId() throws SQLException {
        try (final PreparedStatement ps = database.connection().prepareStatement("SELECT last_insert_rowid()");
             final ResultSet rs = ps.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private static Optional<SkillRecord> single(final PreparedStatement ps) throws SQLException {
        try (final ResultSet rs = ps.executeQuery()) {
            return rs.next() ? Optional.of(SkillRecord.fromResultSet(rs)) : Optional.empty();
        }
    }
}
