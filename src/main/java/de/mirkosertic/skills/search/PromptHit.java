package de.mirkosertic.skills.search;

import org.jspecify.annotations.Nullable;

/**
 * A prompt matching a full-text query. Lower {@code rank} means a better match.
 */
public record PromptHit(
        long id,
        String name,
        String path,
        @Nullable String title,
        @Nullable String author,
        @Nullable String description,
        long sizeBytes,
        int tokenCount,
        String snippet,
        double rank
) {
}
