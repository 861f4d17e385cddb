package de.mirkosertic.skills.output.dto;

import de.mirkosertic.skills.db.PromptRecord;
import org.jspecify.annotations.Nullable;

/**
 * A prompt without its content, as shown in listings.
 */
public record PromptSummary(
        long id,
        String name,
        String path,
        @Nullable String title,
        @Nullable String author,
        @Nullable String description,
        long sizeBytes,
        int tokenCount,
        @Nullable String updatedAt
) {

    public static PromptSummary from(final PromptRecord prompt) {
        return new PromptSummary(
                prompt.id() != null ? prompt.id() : 0L,
                prompt.name(),
                prompt.path(),
                prompt.title(),
                prompt.author(),
                prompt.description(),
                prompt.sizeBytes(),
                prompt.tokenCount(),
                prompt.updatedAt());
    }
}
