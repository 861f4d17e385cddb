package de.mirkosertic.skills.search;

import java.util.List;

/**
 * Aggregate counts over the indexed documents. All values are zero for an empty database.
 */
public record DatabaseStats(
        long skills,
        long prompts,
        long categories,
        long totalSizeBytes,
        long totalTokens,
        List<CategoryCount> categoryBreakdown
) {
}
