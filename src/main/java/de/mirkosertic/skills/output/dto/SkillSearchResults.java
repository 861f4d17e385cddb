package de.mirkosertic.skills.output.dto;

import de.mirkosertic.skills.output.TaggedResult;
import de.mirkosertic.skills.search.SkillHit;
import org.jspecify.annotations.Nullable;

import java.util.List;

public record SkillSearchResults(
        String query,
        @Nullable String category,
        int count,
        List<SkillHit> skills
) implements TaggedResult {

    public static final String TYPE = "skill-search-results";

    public static SkillSearchResults of(final String query, final String category, final List<SkillHit> skills) {
        return new SkillSearchResults(query, category, skills.size(), skills);
    }

    @Override
    public String type() {
        return TYPE;
    }
}
