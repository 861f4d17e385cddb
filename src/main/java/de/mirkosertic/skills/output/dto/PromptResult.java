package de.mirkosertic.skills.output.dto;

import de.mirkosertic.skills.db.FragmentRepository.FragmentSkill;
import de.mirkosertic.skills.db.PromptRecord;
import de.mirkosertic.skills.output.TaggedResult;
import de.mirkosertic.skills.search.PromptDetails;
import org.jspecify.annotations.Nullable;

import java.util.List;

public record PromptResult(PromptView data) implements TaggedResult {

    public static final String TYPE = "prompt";

    /**
     * A prompt with its full content and the skills it embeds or references.
     */
    public record PromptView(
            long id,
            String name,
            String path,
            @Nullable String title,
            @Nullable String author,
            @Nullable String description,
            String content,
            long sizeBytes,
            int tokenCount,
            @Nullable String createdAt,
            @Nullable String updatedAt,
            List<PositionedSkill> embeddedFragments,
            List<PositionedSkill> references
    ) {
    }

    public record PositionedSkill(int position, long id, String category, String name, @Nullable String title) {

        static PositionedSkill from(final FragmentSkill fragmentSkill) {
            return new PositionedSkill(
                    fragmentSkill.position(),
                    fragmentSkill.skill().id() != null ? fragmentSkill.skill().id() : 0L,
                    fragmentSkill.skill().category(),
                    fragmentSkill.skill().name(),
                    fragmentSkill.skill().title());
        }
    }

    public static PromptResult of(final PromptDetails details) {
        final PromptRecord prompt = details.prompt();
        return new PromptResult(new PromptView(
                prompt.id() != null ? prompt.id() : 0L,
                prompt.name(),
                prompt.path(),
                prompt.title(),
                prompt.author(),
                prompt.description(),
                prompt.content(),
                prompt.sizeBytes(),
                prompt.tokenCount(),
                prompt.createdAt(),
                prompt.updatedAt(),
                details.embeddedSkills().stream().map(PositionedSkill::from).toList(),
                details.referenceSkills().stream().map(PositionedSkill::from).toList()));
    }

    @Override
    public String type() {
        return TYPE;
    }
}
