package de.mirkosertic.skills.db;

import org.jspecify.annotations.Nullable;

import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * A row of the {@code prompts} table. Prompts are identified by {@link #name()}, not by path.
 */
public record PromptRecord(
        @Nullable Long id,
        String name,
        String path,
        @Nullable String title,
        @Nullable String author,
        @Nullable String description,
        String content,
        String fileHash,
        long sizeBytes,
        int tokenCount,
        @Nullable String createdAt,
        @Nullable String updatedAt
) {

    public static PromptRecord unsaved(final String name, final String path, final String title,
                                       final String author, final String description, final String content,
                                       final String fileHash, final long sizeBytes, final int tokenCount) {
        return new PromptRecord(null, name, path, title, author, description, content,
                fileHash, sizeBytes, tokenCount, null, null);
    }

    static PromptRecord fromResultSet(final ResultSet rs) throws SQLException {
        return new PromptRecord(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getString("path"),
                rs.getString("title"),
                rs.getString("author"),
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
