package de.mirkosertic.skills.sync;

import de.mirkosertic.skills.db.PromptRecord;
import de.mirkosertic.skills.db.PromptRepository;
import de.mirkosertic.skills.db.SchemaMigrator;
import de.mirkosertic.skills.db.SkillRecord;
import de.mirkosertic.skills.db.SkillRepository;
import de.mirkosertic.skills.db.SkillsDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DocumentUpserter Tests")
class DocumentUpserterTest {

    private static final Instant FIRST_SYNC = Instant.parse("2026-03-01T08:00:00Z");
    private static final Instant SECOND_SYNC = Instant.parse("2026-03-02T08:00:00Z");

    @TempDir
    Path tempDir;

    private SkillsDatabase database;
    private SkillRepository skillRepository;
    private PromptRepository promptRepository;

    @BeforeEach
    void setUp() throws Exception {
        database = new SkillsDatabase(tempDir.resolve("skills.db"));
        database.open();
        new SchemaMigrator(database).migrate();
        skillRepository = new SkillRepository(database);
        promptRepository = new PromptRepository(database);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    private DocumentUpserter upserterAt(final Instant instant) {
        return new DocumentUpserter(skillRepository, promptRepository, Clock.fixed(instant, ZoneOffset.UTC));
    }

    private static SkillRecord skill(final String content) {
        return SkillRecord.unsaved("/p/skills/lang/intro.md", "lang", "intro", null, null, content,
                DocumentMetadataExtractor.fingerprint(content), content.length(),
                DocumentMetadataExtractor.estimateTokens(content));
    }

    @Test
    @DisplayName("Should insert, skip unchanged and update changed skills")
    void shouldDetectChanges() throws Exception {
        // Given
        assertThat(upserterAt(FIRST_SYNC).syncSkill("intro", () -> skill("v1"))).isEqualTo(SyncOutcome.INSERTED);

        // When / Then
        assertThat(upserterAt(SECOND_SYNC).syncSkill("intro", () -> skill("v1"))).isEqualTo(SyncOutcome.SKIPPED);
        assertThat(skillRepository.findByPath("/p/skills/lang/intro.md").orElseThrow().updatedAt())
                .isEqualTo(FIRST_SYNC.toString());

        assertThat(upserterAt(SECOND_SYNC).syncSkill("intro", () -> skill("v2"))).isEqualTo(SyncOutcome.UPDATED);
        final SkillRecord stored = skillRepository.findByPath("/p/skills/lang/intro.md").orElseThrow();
        assertThat(stored.content()).isEqualTo("v2");
        assertThat(stored.createdAt()).isEqualTo(FIRST_SYNC.toString());
        assertThat(stored.updatedAt()).isEqualTo(SECOND_SYNC.toString());
    }

    @Test
    @DisplayName("Should report a failing source as error without storing anything")
    void shouldReportErrors() throws Exception {
        final SyncOutcome outcome = upserterAt(FIRST_SYNC).syncSkill("broken", () -> {
            throw new IOException("unreadable");
        });

        assertThat(outcome).isEqualTo(SyncOutcome.ERROR);
        assertThat(skillRepository.list(null, 100, 0)).isEmpty();
    }

    @Test
    @DisplayName("Should key prompts by name")
    void shouldUpsertPromptsByName() throws Exception {
        final DocumentUpserter upserter = upserterAt(FIRST_SYNC);
        final PromptRecord original = PromptRecord.unsaved("coder", "/p/prompts/coder.md", "Coder", null, null,
                "body", "hash-1", 4, 1);
        final PromptRecord moved = PromptRecord.unsaved("coder", "/q/prompts/coder.md", "Coder", null, null,
                "body", "hash-2", 4, 1);

        assertThat(upserter.syncPrompt("coder", () -> original)).isEqualTo(SyncOutcome.INSERTED);
        assertThat(upserter.syncPrompt("coder", () -> original)).isEqualTo(SyncOutcome.SKIPPED);
        assertThat(upserter.syncPrompt("coder", () -> moved)).isEqualTo(SyncOutcome.UPDATED);

        assertThat(promptRepository.list(100, 0)).singleElement()
                .extracting(PromptRecord::path).isEqualTo("/q/prompts/coder.md");
    }
}
