package de.mirkosertic.skills.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.skills.db.SkillRecord;
import de.mirkosertic.skills.output.dto.CategoryListResult;
import de.mirkosertic.skills.output.dto.SkillListResult;
import de.mirkosertic.skills.output.dto.SkillResult;
import de.mirkosertic.skills.search.CategoryCount;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine.Help.Ansi;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OutputDispatcher Tests")
class OutputDispatcherTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private StringWriter buffer;

    @BeforeEach
    void setUp() {
        buffer = new StringWriter();
    }

    private static SkillRecord skill(final String category, final String name) {
        return new SkillRecord(7L, "/p/skills/" + category + "/" + name + ".md", category, name, "A title", null,
                "full content", "hash", 2048, 512, "2026-01-01T00:00:00Z", "2026-01-01T00:00:00Z");
    }

    /**
     * A result type the CLI never registers a formatter for.
     */
    public record Unregistered(String value) implements TaggedResult {

        @Override
        public String type() {
            return "unregistered";
        }
    }

    @Nested
    @DisplayName("JSON")
    class JsonTests {

        @Test
        @DisplayName("Should write the type tag as first field")
        void shouldWriteTypeFirst() throws Exception {
            final String json = OutputDispatcher.toJson(
                    CategoryListResult.of(List.of(new CategoryCount("language", 2))));

            final JsonNode node = MAPPER.readTree(json);
            assertThat(node.fieldNames().next()).isEqualTo("type");
            assertThat(node.get("type").asText()).isEqualTo("category-list");
            assertThat(node.get("count").asInt()).isEqualTo(1);
            assertThat(node.get("categories").get(0).get("category").asText()).isEqualTo("language");
        }

        @Test
        @DisplayName("Should use kebab case, omit nulls and leave out skill content in lists")
        void shouldUseKebabCase() throws Exception {
            final JsonNode node = MAPPER.readTree(OutputDispatcher.toJson(
                    SkillListResult.of(null, List.of(skill("language", "intro")))));

            assertThat(node.has("category")).isFalse();
            final JsonNode first = node.get("skills").get(0);
            assertThat(first.get("size-bytes").asLong()).isEqualTo(2048);
            assertThat(first.get("token-count").asInt()).isEqualTo(512);
            assertThat(first.has("content")).isFalse();
            assertThat(first.has("description")).isFalse();
        }

        @Test
        @DisplayName("Should write JSON in JSON mode even with a formatter registered")
        void shouldWriteJsonInJsonMode() throws Exception {
            final OutputDispatcher dispatcher = OutputDispatcher.withDefaultFormatters(new PrintWriter(buffer), Ansi.OFF);

            dispatcher.write(CategoryListResult.of(List.of()), OutputFormat.JSON);

            assertThat(MAPPER.readTree(buffer.toString()).get("type").asText()).isEqualTo("category-list");
        }
    }

    @Nested
    @DisplayName("Human")
    class HumanTests {

        @Test
        @DisplayName("Should register a formatter for every result type")
        void shouldRegisterAllTags() {
            final OutputDispatcher dispatcher = OutputDispatcher.withDefaultFormatters(new PrintWriter(buffer), Ansi.OFF);

            assertThat(dispatcher.registeredTags()).containsExactlyInAnyOrder(
                    "skill", "skill-list", "skill-search-results",
                    "prompt", "prompt-list", "prompt-search-results",
                    "search-results", "stats", "category-list", "sync-summary");
        }

        @Test
        @DisplayName("Should render a skill list as table without ANSI codes")
        void shouldRenderSkillList() {
            final OutputDispatcher dispatcher = OutputDispatcher.withDefaultFormatters(new PrintWriter(buffer), Ansi.OFF);

            dispatcher.write(SkillListResult.of(null, List.of(skill("language", "clojure_intro"))), OutputFormat.HUMAN);

            final String text = buffer.toString();
            assertThat(text).contains("Total: 1 skills");
            assertThat(text).contains("clojure_intro").contains("language").contains("2.0").contains("512");
            assertThat(text).doesNotContain("\u001B[");
        }

        @Test
        @DisplayName("Should print names and titles containing markup characters verbatim")
        void shouldPrintMarkupCharactersVerbatim() {
            final OutputDispatcher dispatcher = OutputDispatcher.withDefaultFormatters(new PrintWriter(buffer), Ansi.OFF);
            final SkillRecord skill = new SkillRecord(1L, "/p/skills/x/odd.md", "x", "odd|@name", "@|red title|@",
                    null, "content", "hash", 10, 2, null, null);

            dispatcher.write(new SkillResult(skill), OutputFormat.HUMAN);
            dispatcher.write(SkillListResult.of(null, List.of(skill)), OutputFormat.HUMAN);

            final String text = buffer.toString();
            assertThat(text).contains("odd|@name").contains("@|red title|@");
        }

        @Test
        @DisplayName("Should style labels with ANSI codes when enabled and keep user text intact")
        void shouldStyleWithAnsiEnabled() {
            final OutputDispatcher dispatcher = OutputDispatcher.withDefaultFormatters(new PrintWriter(buffer), Ansi.ON);

            dispatcher.write(CategoryListResult.of(List.of(new CategoryCount("a@|b", 1))), OutputFormat.HUMAN);

            final String text = buffer.toString();
            assertThat(text).contains("\u001B[").contains("a@|b");
        }

        @Test
        @DisplayName("Should render categories")
        void shouldRenderCategories() {
            final OutputDispatcher dispatcher = OutputDispatcher.withDefaultFormatters(new PrintWriter(buffer), Ansi.OFF);

            dispatcher.write(CategoryListResult.of(List.of(new CategoryCount("tooling", 3))), OutputFormat.HUMAN);

            assertThat(buffer.toString()).contains("Total: 1 categories").contains("tooling").contains("3");
        }

        @Test
        @DisplayName("Should fall back to JSON for a tag without formatter")
        void shouldFallBackToJson() throws Exception {
            final OutputDispatcher dispatcher = OutputDispatcher.withDefaultFormatters(new PrintWriter(buffer), Ansi.OFF);

            dispatcher.write(new Unregistered("x"), OutputFormat.HUMAN);

            final JsonNode node = MAPPER.readTree(buffer.toString());
            assertThat(node.get("type").asText()).isEqualTo("unregistered");
            assertThat(node.get("value").asText()).isEqualTo("x");
        }

        @Test
        @DisplayName("Should use a custom registered formatter")
        void shouldUseCustomFormatter() {
            final OutputDispatcher dispatcher = new OutputDispatcher(new PrintWriter(buffer), Ansi.OFF)
                    .register("unregistered", Unregistered.class, (result, out, ansi) -> out.print("value=" + result.value()));

            dispatcher.write(new Unregistered("y"), OutputFormat.HUMAN);

            assertThat(buffer.toString()).isEqualTo("value=y");
        }
    }
}
