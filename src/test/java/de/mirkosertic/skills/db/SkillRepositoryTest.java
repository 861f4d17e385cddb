package de.mirkosertic.skills.db;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SkillRepository and PromptRepository Tests")
class SkillRepositoryTest {

    private static final Instant CREATED = Instant.parse("2026-01-01T10:00:00Z");
    private static final Instant UPDATED = Instant.parse("2026-01-02T10:00:00Z");

    @TempDir
    Path tempDir;

    private SkillsDatabase database;
    private SkillRepository skills;
    private PromptRepository prompts;

    @BeforeEach
    void setUp() throws Exception {
        database = new SkillsDatabase(tempDir.resolve("skills.db"));
        database.open();
        new SchemaMigrator(database).migrate();
        skills = new SkillRepository(database);
        prompts = new PromptRepository(database);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    private static SkillRecord skill(final String category, final String name, final String hash) {
        return SkillRecord.unsaved("/project/skills/" + category + "/" + name + ".md", category, name,
                "Title of " + name, null, "content of " + name, hash, 100, 25);
    }

    @Nested
    @DisplayName("Skills")
    class SkillTests {

        @Test
        @DisplayName("Should insert a skill with both timestamps")
        void shouldInsertSkill() throws SQLException {
            final long id = skills.insert(skill("language", "clojure_intro", "h1"), CREATED);

            final SkillRecord stored = skills.findByPath("/project/skills/language/clojure_intro.md").orElseThrow();
            assertThat(stored.id()).isEqualTo(id);
            assertThat(stored.category()).isEqualTo("language");
            assertThat(stored.title()).isEqualTo("Title of clojure_intro");
            assertThat(stored.description()).isNull();
            assertThat(stored.createdAt()).isEqualTo(CREATED.toString());
            assertThat(stored.updatedAt()).isEqualTo(CREATED.toString());
        }

        @Test
        @DisplayName("Should update mutable fields and keep created_at")
        void shouldUpdateSkill() throws SQLException {
            skills.insert(skill("language", "clojure_intro", "h1"), CREATED);

            final SkillRecord changed = SkillRecord.unsaved("/project/skills/language/clojure_intro.md",
                    "language", "clojure_intro", "New title", "Now described", "new content", "h2", 200, 50);
            skills.update(changed, UPDATED);

            final SkillRecord stored = skills.findByPath(changed.path()).orElseThrow();
            assertThat(stored.title()).isEqualTo("New title");
            assertThat(stored.description()).isEqualTo("Now described");
            assertThat(stored.fileHash()).isEqualTo("h2");
            assertThat(stored.sizeBytes()).isEqualTo(200);
            assertThat(stored.tokenCount()).isEqualTo(50);
            assertThat(stored.createdAt()).isEqualTo(CREATED.toString());
            assertThat(stored.updatedAt()).isEqualTo(UPDATED.toString());
        }

        @Test
        @DisplayName("Should find skills by name with optional category")
        void shouldFindByName() throws SQLException {
            skills.insert(skill("language", "intro", "h1"), CREATED);
            skills.insert(skill("tooling", "intro", "h2"), CREATED);

            assertThat(skills.findByName("intro", null)).get()
                    .extracting(SkillRecord::category).isEqualTo("language");
            assertThat(skills.findByName("intro", "tooling")).get()
                    .extracting(SkillRecord::category).isEqualTo("tooling");
            assertThat(skills.findByName("intro", "missing")).isEmpty();
        }

        @Test
        @DisplayName("Should list skills by category and name with pagination")
        void shouldListWithPagination() throws SQLException {
            skills.insert(skill("tooling", "b", "h1"), CREATED);
            skills.insert(skill("language", "z", "h2"), CREATED);
            skills.insert(skill("language", "a", "h3"), CREATED);

            assertThat(skills.list(null, 100, 0)).extracting(SkillRecord::name).containsExactly("a", "z", "b");
            assertThat(skills.list(null, 1, 1)).extracting(SkillRecord::name).containsExactly("z");
            assertThat(skills.list("tooling", 100, 0)).extracting(SkillRecord::name).containsExactly("b");
        }
    }

    @Nested
    @DisplayName("Prompts")
    class PromptTests {

        @Test
        @DisplayName("Should identify prompts by name and update their path")
        void shouldUpdatePromptByName() throws SQLException {
            prompts.insert(PromptRecord.unsaved("coder", "/old/coder.md", "Coder", "me", null,
                    "body", "h1", 10, 1), CREATED);

            prompts.update(PromptRecord.unsaved("coder", "/new/coder.md", "Coder 2", "you", "desc",
                    "new body", "h2", 20, 2), UPDATED);

            final PromptRecord stored = prompts.findByName("coder").orElseThrow();
            assertThat(stored.path()).isEqualTo("/new/coder.md");
            assertThat(stored.title()).isEqualTo("Coder 2");
            assertThat(stored.author()).isEqualTo("you");
            assertThat(stored.createdAt()).isEqualTo(CREATED.toString());
            assertThat(stored.updatedAt()).isEqualTo(UPDATED.toString());
        }

        @Test
        @DisplayName("Should list prompts ordered by name")
        void shouldListPromptsByName() throws SQLException {
            prompts.insert(PromptRecord.unsaved("zeta", "/z.md", null, null, null, "z", "h1", 1, 0), CREATED);
            prompts.insert(PromptRecord.unsaved("alpha", "/a.md", null, null, null, "a", "h2", 1, 0), CREATED);

            final List<PromptRecord> listed = prompts.list(100, 0);

            assertThat(listed).extracting(PromptRecord::name).containsExactly("alpha", "zeta");
        }
    }
}
