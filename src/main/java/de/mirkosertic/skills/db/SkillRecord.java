package de.mirkosertic.skills.db;

import org.jspecify.annotations.Nullable;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * A row of the {@code skills} table. Unsaved records carry a null id and null timestamps.
 */
public record SkillRecord(
        @Nullable Long id,
        String path,
        String category,
        String name,
        @Nullable String title,
        @Nullable String description,
        String content,
        String fileHash,
        long sizeBytes,
        int tokenCount,
        @Nullable String createdAt,
        @Nullable String updatedAt
) {

    public static SkillRecord unsaved(final String path, final String category, final String name,
                                      final String title, final String description, final String content,
                                      final String fileHash, final long sizeBytes, final int tokenCount) {
        return new SkillRecord(null, path, category, name, title, description, content,
                fileHash, sizeBytes, tokenCount, null, null);
    }

    static SkillRecord fromResultSet(final ResultSet rs) throws SQLException {
        return new SkillRecord(
                rs.getLong("id"),
                rs.getString("path"),
                rs.getString("category"),
                rs.getString("name"),
                rs.getString("title"),
                rs.getString("description"),
                rs.getString("content"),
                rs.getString("file_hash"),
                rs.getLong("size_bytes"),
                rs.getInt("token_count"),
                rs.getString("created_at"),
                rs.getString("updated_at")
        );
    }
}
