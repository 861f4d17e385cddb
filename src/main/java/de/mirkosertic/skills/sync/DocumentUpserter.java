package de.mirkosertic.skills.sync;

import de.mirkosertic.skills.db.PromptRecord;
import de.mirkosertic.skills.db.PromptRepository;
import de.mirkosertic.skills.db.SkillRecord;
import de.mirkosertic.skills.db.SkillRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Writes documents to the database, skipping those whose content hash did not change.
 * <p>
 * Skills are keyed by path, prompts by name. An update rewrites every mutable column and
 * refreshes {@code updated_at}; an unchanged document is not written at all.
 */
public class DocumentUpserter {

    private static final Logger logger = LoggerFactory.getLogger(DocumentUpserter.class);

    /**
     * Produces the record to store. Reading may fail for I/O or parse reasons.
     */
    @FunctionalInterface
    public interface DocumentSource<T> {
        T read() throws Exception;
    }

    private final SkillRepository skillRepository;
    private final PromptRepository promptRepository;
    private final Clock clock;

    public DocumentUpserter(final SkillRepository skillRepository, final PromptRepository promptRepository,
                            final Clock clock) {
        this.skillRepository = skillRepository;
        this.promptRepository = promptRepository;
        this.clock = clock;
    }

    /**
     * Read and store a skill. Any failure is logged and reported as {@link SyncOutcome#ERROR}.
     */
    public SyncOutcome syncSkill(final String label, final DocumentSource<SkillRecord> source) {
        try {
            return storeSkill(source.read());
        } catch (final Exception e) {
            logger.error("Error syncing skill {}: {}", label, e.getMessage(), e);
            return SyncOutcome.ERROR;
        }
    }

    /**
     * Read and store a prompt. Any failure is logged and reported as {@link SyncOutcome#ERROR}.
     */
    public SyncOutcome syncPrompt(final String label, final DocumentSource<PromptRecord> source) {
        try {
            return storePrompt(source.read());
        } catch (final Exception e) {
            logger.error("Error syncing prompt {}: {}", label, e.getMessage(), e);
            return SyncOutcome.ERROR;
        }
    }

    SyncOutcome storeSkill(final SkillRecord skill) throws SQLException {
        final Optional<SkillRecord> existing = skillRepository.findByPath(skill.path());
        final Instant now = clock.instant();
        if (existing.isEmpty()) {
            skillRepository.insert(skill, now);
            logger.debug("Inserted skill {}", skill.path());
            return SyncOutcome.INSERTED;
        }
        if (existing.get().fileHash().equals(skill.fileHash())) {
            logger.debug("Skipped unchanged skill {}", skill.path());
            return SyncOutcome.SKIPPED;
        }
        skillRepository.update(skill, now);
        logger.debug("Updated skill {}", skill.path());
        return SyncOutcome.UPDATED;
    }

    SyncOutcome storePrompt(final PromptRecord prompt) throws SQLException {
        final Optional<PromptRecord> existing = promptRepository.findByName(prompt.name());
        final Instant now = clock.instant();
        if (existing.isEmpty()) {
            promptRepository.insert(prompt, now);
            logger.debug("Inserted prompt {}", prompt.name());
            return SyncOutcome.INSERTED;
        }
        if (existing.get().fileHash().equals(prompt.fileHash())) {
            logger.debug("Skipped unchanged prompt {}", prompt.name());
            return SyncOutcome.SKIPPED;
        }
        promptRepository.update(prompt, now);
        logger.debug("Updated prompt {}", prompt.name());
        return SyncOutcome.UPDATED;
    }
}
