package de.mirkosertic.skills.output.dto;

import de.mirkosertic.skills.db.SkillRecord;
import org.jspecify.annotations.Nullable;

/**
 * A skill without its content, as shown in listings.
 */
public record SkillSummary(
        long id,
        String path,
        String category,
        String name,
        @Nullable String title,
        @Nullable String description,
        long sizeBytes,
        int tokenCount,
        @Nullable String updatedAt
) {

    public static SkillSummary from(final SkillRecord skill) {
        return new SkillSummary(
                skill.id() != null ? skill.id() : 0L,
                skill.path(),
                skill.category(),
                skill.name(),
                skill.title(),
                skill.description(),
                skill.sizeBytes(),
                skill.tokenCount(),
                skill.updatedAt());
    }
}
