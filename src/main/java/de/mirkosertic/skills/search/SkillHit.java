package de.mirkosertic.skills.search;

import org.jspecify.annotations.Nullable;

/**
 * A skill matching a full-text query. Lower {@code rank} means a better match.
 */
public record SkillHit(
        long id,
        String path,
        String category,
        String name,
        @Nullable String title,
        @Nullable String description,
        long sizeBytes,
        int tokenCount,
        String snippet,
        double rank
) {
}
