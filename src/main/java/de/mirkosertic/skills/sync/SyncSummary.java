package de.mirkosertic.skills.sync;

import java.util.List;

/**
 * Aggregated result of a full sync run.
 */
public record SyncSummary(
        List<FileResult> files,
        int inserted,
        int updated,
        int skipped,
        int errors,
        /** Number of prompts whose fragment associations were rebuilt. */
        int promptsLinked,
        /** Number of skill associations written across all prompts. */
        int skillAssociations,
        List<String> warnings,
        long elapsedMs
) {

    /**
     * Outcome for one skill, prompt or descriptor file.
     */
    public record FileResult(DocumentKind kind, String path, SyncOutcome outcome) {
    }

    public enum DocumentKind {
        SKILL,
        PROMPT
    }

    public int total() {
        return files.size();
    }

    public boolean hasErrors() {
        return errors > 0;
    }
}
