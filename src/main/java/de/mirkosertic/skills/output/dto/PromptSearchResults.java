package de.mirkosertic.skills.output.dto;

import de.mirkosertic.skills.output.TaggedResult;
import de.mirkosertic.skills.search.PromptHit;

import java.util.List;

public record PromptSearchResults(
        String query,
        int count,
        List<PromptHit> prompts
) implements TaggedResult {

    public static final String TYPE = "prompt-search-results";

    public static PromptSearchResults of(final String query, final List<PromptHit> prompts) {
        return new PromptSearchResults(query, prompts.size(), prompts);
    }

    @Override
    public String type() {
        return TYPE;
    }
}
