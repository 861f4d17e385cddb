package de.mirkosertic.skills.sync;

/**
 * Result of synchronising one document.
 */
public enum SyncOutcome {
    INSERTED,
    UPDATED,
    SKIPPED,
    ERROR
}
