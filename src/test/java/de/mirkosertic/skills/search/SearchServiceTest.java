package de.mirkosertic.skills.search;

import de.mirkosertic.skills.TestProject;
import de.mirkosertic.skills.db.FragmentRepository.FragmentSkill;
import de.mirkosertic.skills.db.PromptRecord;
import de.mirkosertic.skills.db.SchemaMigrator;
import de.mirkosertic.skills.db.SkillRecord;
import de.mirkosertic.skills.db.SkillsDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SearchService Tests")
class SearchServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-05-01T09:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private TestProject project;
    private SkillsDatabase database;
    private SearchService service;

    @BeforeEach
    void setUp() throws Exception {
        project = new TestProject(tempDir);
        database = new SkillsDatabase(project.databasePath());
        database.open();
        new SchemaMigrator(database).migrate();
        service = new SearchService(database, 50);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    @DisplayName("Should report zero statistics for an empty database")
    void shouldReportEmptyStats() throws SQLException {
        final DatabaseStats stats = service.stats();

        assertThat(stats.skills()).isZero();
        assertThat(stats.prompts()).isZero();
        assertThat(stats.categories()).isZero();
        assertThat(stats.totalSizeBytes()).isZero();
        assertThat(stats.totalTokens()).isZero();
        assertThat(stats.categoryBreakdown()).isEmpty();
    }

    @Nested
    @DisplayName("With synced project")
    class SyncedTests {

        @BeforeEach
        void syncProject() throws Exception {
            project.skill("language/clojure_intro.md",
                    "---\ntitle: Clojure Intro\n---\nClojure is a functional language on the JVM.");
            project.skill("testing/unit/test_basics.md", "Write unit tests for Clojure code with clojure.test.");
            project.skill("tooling/repl.md", "The REPL is an interactive shell.");
            project.prompt("coder", "Act as a senior Clojure engineer.");
            project.descriptor("coder.yaml", """
                    title: Coder
                    author: Jane
                    fragments:
                      - skills/language/clojure_intro.md
                    references:
                      - skills/tooling/repl.md
                    """);
            project.sync(database, CLOCK);
        }

        @Test
        @DisplayName("Should find skills with snippets")
        void shouldSearchSkills() throws SQLException {
            final List<SkillHit> hits = service.searchSkills("clojure", null, null);

            assertThat(hits).extracting(SkillHit::name).containsExactlyInAnyOrder("clojure_intro", "test_basics");
            assertThat(hits).allSatisfy(hit -> assertThat(hit.snippet()).contains("["));
        }

        @Test
        @DisplayName("Should restrict skill search to a category")
        void shouldFilterByCategory() throws SQLException {
            final List<SkillHit> hits = service.searchSkills("clojure", null, "testing/unit");

            assertThat(hits).singleElement().extracting(SkillHit::name).isEqualTo("test_basics");
        }

        @Test
        @DisplayName("Should honour max results")
        void shouldLimitResults() throws SQLException {
            assertThat(service.searchSkills("clojure", 1, null)).hasSize(1);
        }

        @Test
        @DisplayName("Should return no hits for an unknown term")
        void shouldReturnNoHits() throws SQLException {
            assertThat(service.searchSkills("haskell", null, null)).isEmpty();
        }

        @Test
        @DisplayName("Should search prompts and both types together")
        void shouldSearchPromptsAndAll() throws SQLException {
            assertThat(service.searchPrompts("engineer", null)).singleElement()
                    .extracting(PromptHit::name).isEqualTo("coder");

            final SearchService.CombinedResults all = service.searchAll("clojure", null, null);
            assertThat(all.skills()).hasSize(2);
            assertThat(all.prompts()).hasSize(1);
        }

        @Test
        @DisplayName("Should list skills, prompts and categories")
        void shouldList() throws SQLException {
            assertThat(service.listSkills(null, null, null)).extracting(SkillRecord::name)
                    .containsExactly("clojure_intro", "test_basics", "repl");
            assertThat(service.listSkills("tooling", null, null)).extracting(SkillRecord::name)
                    .containsExactly("repl");
            assertThat(service.listPrompts(null, null)).extracting(PromptRecord::name).containsExactly("coder");
            assertThat(service.listCategories()).containsExactly(
                    new CategoryCount("language", 1),
                    new CategoryCount("testing/unit", 1),
                    new CategoryCount("tooling", 1));
        }

        @Test
        @DisplayName("Should look up skills by name")
        void shouldGetSkillByName() throws SQLException {
            assertThat(service.getSkillByName("repl", null)).get()
                    .extracting(SkillRecord::category).isEqualTo("tooling");
            assertThat(service.getSkillByName("repl", "language")).isEmpty();
        }

        @Test
        @DisplayName("Should resolve prompt details with embedded and reference skills")
        void shouldGetPromptDetails() throws SQLException {
            final PromptDetails details = service.getPromptByName("coder").orElseThrow();

            assertThat(details.prompt().author()).isEqualTo("Jane");
            assertThat(details.embeddedSkills()).extracting(fs -> fs.skill().name()).containsExactly("clojure_intro");
            assertThat(details.referenceSkills()).extracting(FragmentSkill::position).containsExactly(0);
            assertThat(details.referenceSkills()).extracting(fs -> fs.skill().name()).containsExactly("repl");
            assertThat(service.getPromptByName("unknown")).isEmpty();
        }

        @Test
        @DisplayName("Should aggregate statistics")
        void shouldAggregateStats() throws SQLException {
            final DatabaseStats stats = service.stats();

            assertThat(stats.skills()).isEqualTo(3);
            assertThat(stats.prompts()).isEqualTo(1);
            assertThat(stats.categories()).isEqualTo(3);
            assertThat(stats.totalSizeBytes()).isPositive();
            assertThat(stats.totalTokens()).isPositive();
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Should reject a blank query")
        void shouldRejectBlankQuery() {
            assertThatThrownBy(() -> service.searchSkills("  ", null, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Search query must not be empty");
            assertThatThrownBy(() -> service.searchAll("", null, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should reject max results below one")
        void shouldRejectInvalidMaxResults() {
            assertThatThrownBy(() -> service.searchPrompts("x", 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should reject a blank name")
        void shouldRejectBlankName() {
            assertThatThrownBy(() -> service.getPromptByName(" "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Name must not be empty");
        }
    }
}
