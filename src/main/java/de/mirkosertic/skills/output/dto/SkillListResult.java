package de.mirkosertic.skills.output.dto;

import de.mirkosertic.skills.db.SkillRecord;
import de.mirkosertic.skills.output.TaggedResult;
import org.jspecify.annotations.Nullable;

import java.util.List;

public record SkillListResult(
        @Nullable String category,
        int count,
        List<SkillSummary> skills
) implements TaggedResult {

    public static final String TYPE = "skill-list";

    public static SkillListResult of(final String category, final List<SkillRecord> skills) {
        return new SkillListResult(category, skills.size(), skills.stream().map(SkillSummary::from).toList());
    }

    @Override
    public String type() {
        return TYPE;
    }
}
