package de.mirkosertic.skills.output.dto;

import de.mirkosertic.skills.db.PromptRecord;
import de.mirkosertic.skills.output.TaggedResult;

import java.util.List;

public record PromptListResult(int count, List<PromptSummary> prompts) implements TaggedResult {

    public static final String TYPE = "prompt-list";

    public static PromptListResult of(final List<PromptRecord> prompts) {
        return new PromptListResult(prompts.size(), prompts.stream().map(PromptSummary::from).toList());
    }

    @Override
    public String type() {
        return TYPE;
    }
}
