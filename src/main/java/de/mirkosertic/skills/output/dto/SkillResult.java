package de.mirkosertic.skills.output.dto;

import de.mirkosertic.skills.db.SkillRecord;
import de.mirkosertic.skills.output.TaggedResult;

public record SkillResult(SkillRecord data) implements TaggedResult {

    public static final String TYPE = "skill";

    @Override
    public String type() {
        return TYPE;
    }
}
