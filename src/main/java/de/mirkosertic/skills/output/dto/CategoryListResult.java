package de.mirkosertic.skills.output.dto;

import de.mirkosertic.skills.output.TaggedResult;
import de.mirkosertic.skills.search.CategoryCount;

import java.util.List;

public record CategoryListResult(int count, List<CategoryCount> categories) implements TaggedResult {

    public static final String TYPE = "category-list";

    public static CategoryListResult of(final List<CategoryCount> categories) {
        return new CategoryListResult(categories.size(), categories);
    }

    @Override
    public String type() {
        return TYPE;
    }
}
