package de.mirkosertic.skills.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.skills.EventLog;
import de.mirkosertic.skills.SkillsApplication;
import de.mirkosertic.skills.TestProject;
import de.mirkosertic.skills.config.ApplicationConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine.Help.Ansi;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CLI Tests")
class SkillsCommandTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-06-01T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private TestProject project;
    private ApplicationConfig config;

    private String stdout;
    private String stderr;

    @BeforeEach
    void setUp() throws Exception {
        project = new TestProject(tempDir);
        config = project.config();
        project.skill("language/clojure_intro.md", "---\ntitle: Clojure Intro\n---\nClojure is a Lisp.");
        project.skill("tooling/repl.md", "Use the REPL for Clojure development.");
        project.prompt("coder", "Act as a Clojure engineer.");
        project.descriptor("coder.yaml", """
                title: Coder
                fragments:
                  - skills/language/clojure_intro.md
                references:
                  - skills/tooling/repl.md
                """);
    }

    private int run(final String... args) {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        final ByteArrayOutputStream err = new ByteArrayOutputStream();
        final CliContext context = new CliContext(() -> config, new EventLog(), CLOCK, Ansi.OFF);
        final int exitCode = SkillsApplication.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8),
                context);
        stdout = out.toString(StandardCharsets.UTF_8);
        stderr = err.toString(StandardCharsets.UTF_8);
        return exitCode;
    }

    private JsonNode json() throws Exception {
        return MAPPER.readTree(stdout);
    }

    @Nested
    @DisplayName("db")
    class DbTests {

        @Test
        @DisplayName("Should refuse to reset without --force and not touch the database")
        void shouldRefuseResetWithoutForce() {
            final int exitCode = run("db", "reset");

            assertThat(exitCode).isEqualTo(1);
            assertThat(stderr).contains("ERROR: This will DELETE all data in the database!")
                    .contains("Use --force to confirm.");
            assertThat(stdout).isEmpty();
            assertThat(project.databasePath()).doesNotExist();
        }

        @Test
        @DisplayName("Should sync the project and report a summary")
        void shouldSync() throws Exception {
            final int exitCode = run("db", "sync");

            assertThat(exitCode).isZero();
            final JsonNode summary = json();
            assertThat(summary.get("type").asText()).isEqualTo("sync-summary");
            assertThat(summary.get("inserted").asInt()).isEqualTo(3);
            assertThat(summary.get("prompts-linked").asInt()).isEqualTo(1);
            assertThat(summary.get("skill-associations").asInt()).isEqualTo(2);
            assertThat(stderr).contains("SUCCESS:");
        }

        @Test
        @DisplayName("Should clear all data on reset with --force")
        void shouldResetWithForce() throws Exception {
            run("db", "sync");

            assertThat(run("db", "reset", "--force")).isZero();

            run("db", "stats");
            assertThat(json().get("database").get("skills").asInt()).isZero();
        }

        @Test
        @DisplayName("Should report statistics")
        void shouldReportStats() throws Exception {
            run("db", "sync");

            assertThat(run("db", "stats")).isZero();

            final JsonNode stats = json();
            assertThat(stats.get("type").asText()).isEqualTo("stats");
            assertThat(stats.get("database").get("skills").asInt()).isEqualTo(2);
            assertThat(stats.get("database").get("prompts").asInt()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Queries after sync")
    class QueryTests {

        @BeforeEach
        void sync() {
            assertThat(run("db", "sync")).isZero();
        }

        @Test
        @DisplayName("Should search skills as JSON")
        void shouldSearchSkills() throws Exception {
            assertThat(run("skill", "search", "lisp")).isZero();

            final JsonNode result = json();
            assertThat(result.get("type").asText()).isEqualTo("skill-search-results");
            assertThat(result.get("count").asInt()).isEqualTo(1);
            assertThat(result.get("skills").get(0).get("name").asText()).isEqualTo("clojure_intro");
        }

        @Test
        @DisplayName("Should fail on an empty search query")
        void shouldRejectEmptyQuery() {
            assertThat(run("skill", "search")).isEqualTo(1);
            assertThat(stderr).contains("Search query cannot be empty");
        }

        @Test
        @DisplayName("Should fail when a skill does not exist")
        void shouldFailForUnknownSkill() {
            assertThat(run("skill", "show", "nope")).isEqualTo(1);
            assertThat(stderr).contains("Skill not found: nope");
        }

        @Test
        @DisplayName("Should show a skill")
        void shouldShowSkill() throws Exception {
            assertThat(run("skill", "show", "repl", "-c", "tooling")).isZero();

            final JsonNode result = json();
            assertThat(result.get("type").asText()).isEqualTo("skill");
            assertThat(result.get("data").get("content").asText()).contains("REPL");
        }

        @Test
        @DisplayName("Should list skills in human format")
        void shouldListSkillsHuman() {
            assertThat(run("skill", "list", "--human")).isZero();

            assertThat(stdout).contains("Total: 2 skills").contains("clojure_intro").contains("repl");
        }

        @Test
        @DisplayName("Should show a prompt with embedded and referenced skills")
        void shouldShowPrompt() throws Exception {
            assertThat(run("prompt", "show", "coder")).isZero();

            final JsonNode data = json().get("data");
            assertThat(data.get("name").asText()).isEqualTo("coder");
            assertThat(data.get("embedded-fragments").get(0).get("name").asText()).isEqualTo("clojure_intro");
            assertThat(data.get("references").get(0).get("name").asText()).isEqualTo("repl");
        }

        @Test
        @DisplayName("Should render a prompt in human format")
        void shouldShowPromptHuman() {
            assertThat(run("prompt", "show", "coder", "--human")).isZero();

            assertThat(stdout).contains("Embedded Skills:")
                    .contains("0. [language] clojure_intro")
                    .contains("References:")
                    .contains("0. [tooling] repl")
                    .contains("Content Preview:");
        }

        @Test
        @DisplayName("Should fail when a prompt does not exist")
        void shouldFailForUnknownPrompt() {
            assertThat(run("prompt", "show", "ghost")).isEqualTo(1);
            assertThat(stderr).contains("Prompt not found: ghost");
        }

        @Test
        @DisplayName("Should search skills and prompts together")
        void shouldSearchAll() throws Exception {
            assertThat(run("search", "clojure")).isZero();

            final JsonNode result = json();
            assertThat(result.get("type").asText()).isEqualTo("search-results");
            assertThat(result.get("skills")).hasSize(2);
            assertThat(result.get("prompts")).hasSize(1);
        }

        @Test
        @DisplayName("Should search only prompts with --type")
        void shouldSearchPromptsOnly() throws Exception {
            assertThat(run("search", "clojure", "--type", "PROMPTS")).isZero();

            final JsonNode result = json();
            assertThat(result.get("skills")).isEmpty();
            assertThat(result.get("prompts")).hasSize(1);
        }

        @Test
        @DisplayName("Should list categories")
        void shouldListCategories() throws Exception {
            assertThat(run("category", "list")).isZero();

            final JsonNode result = json();
            assertThat(result.get("count").asInt()).isEqualTo(2);
            assertThat(result.get("categories").get(0).get("category").asText()).isEqualTo("language");
        }

        @Test
        @DisplayName("Should turn an invalid FTS query into an error line")
        void shouldReportInvalidQuery() {
            assertThat(run("skill", "search", "\"unbalanced")).isEqualTo(1);
            assertThat(stderr).contains("ERROR:");
        }
    }

    @Test
    @DisplayName("Should honour the configured human output format")
    void shouldUseConfiguredFormat() {
        config = project.config(Map.of("output", Map.of("format", "human")));

        assertThat(run("category", "list")).isZero();

        assertThat(stdout).contains("Total: 0 categories");
    }
}
