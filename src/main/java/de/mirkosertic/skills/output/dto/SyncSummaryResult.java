package de.mirkosertic.skills.output.dto;

import de.mirkosertic.skills.output.TaggedResult;
import de.mirkosertic.skills.sync.SyncSummary;

import java.util.List;

public record SyncSummaryResult(
        int total,
        int inserted,
        int updated,
        int skipped,
        int errors,
        int promptsLinked,
        int skillAssociations,
        long elapsedMs,
        List<String> warnings,
        List<SyncSummary.FileResult> files
) implements TaggedResult {

    public static final String TYPE = "sync-summary";

    public static SyncSummaryResult of(final SyncSummary summary) {
        return new SyncSummaryResult(
                summary.total(),
                summary.inserted(),
                summary.updated(),
                summary.skipped(),
                summary.errors(),
                summary.promptsLinked(),
                summary.skillAssociations(),
                summary.elapsedMs(),
                summary.warnings(),
                summary.files());
    }

    @Override
    public String type() {
        return TYPE;
    }
}
