package de.mirkosertic.skills.output.dto;

import de.mirkosertic.skills.output.TaggedResult;
import de.mirkosertic.skills.search.PromptHit;
import de.mirkosertic.skills.search.SkillHit;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Combined skill and prompt hits of one query.
 */
public record SearchResults(
        String query,
        @Nullable String category,
        int skillCount,
        int promptCount,
        List<SkillHit> skills,
        List<PromptHit> prompts
) implements TaggedResult {

    public static final String TYPE = "search-results";

    public static SearchResults of(final String query, final String category, final List<SkillHit> skills,
                                   final List<PromptHit> prompts) {
        return new SearchResults(query, category, skills.size(), prompts.size(), skills, prompts);
    }

    @Override
    public String type() {
        return TYPE;
    }
}
