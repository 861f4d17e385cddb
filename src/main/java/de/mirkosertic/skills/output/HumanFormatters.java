package de.mirkosertic.skills.output;

import de.mirkosertic.skills.db.SkillRecord;
import de.mirkosertic.skills.output.dto.CategoryListResult;
import de.mirkosertic.skills.output.dto.PromptListResult;
import de.mirkosertic.skills.output.dto.PromptResult;
import de.mirkosertic.skills.output.dto.PromptSearchResults;
import de.mirkosertic.skills.output.dto.PromptSummary;
import de.mirkosertic.skills.output.dto.SearchResults;
import de.mirkosertic.skills.output.dto.SkillListResult;
import de.mirkosertic.skills.output.dto.SkillResult;
import de.mirkosertic.skills.output.dto.SkillSearchResults;
import de.mirkosertic.skills.output.dto.SkillSummary;
import de.mirkosertic.skills.output.dto.StatsResult;
import de.mirkosertic.skills.output.dto.SyncSummaryResult;
import de.mirkosertic.skills.search.CategoryCount;
import de.mirkosertic.skills.search.PromptHit;
import de.mirkosertic.skills.search.SkillHit;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Help.Ansi.Style;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Terminal renderings of the CLI result types.
 */
final class HumanFormatters {

    static final int CONTENT_PREVIEW_LENGTH = 500;

    private HumanFormatters() {
    }

    static void registerAll(final OutputDispatcher dispatcher) {
        dispatcher
                .register(SkillResult.TYPE, SkillResult.class, HumanFormatters::skill)
                .register(SkillListResult.TYPE, SkillListResult.class, HumanFormatters::skillList)
                .register(SkillSearchResults.TYPE, SkillSearchResults.class, HumanFormatters::skillSearchResults)
                .register(PromptResult.TYPE, PromptResult.class, HumanFormatters::prompt)
                .register(PromptListResult.TYPE, PromptListResult.class, HumanFormatters::promptList)
                .register(PromptSearchResults.TYPE, PromptSearchResults.class, HumanFormatters::promptSearchResults)
                .register(SearchResults.TYPE, SearchResults.class, HumanFormatters::searchResults)
                .register(StatsResult.TYPE, StatsResult.class, HumanFormatters::stats)
                .register(CategoryListResult.TYPE, CategoryListResult.class, HumanFormatters::categoryList)
                .register(SyncSummaryResult.TYPE, SyncSummaryResult.class, HumanFormatters::syncSummary);
    }

    static void skill(final SkillResult result, final PrintWriter out, final Ansi ansi) {
        final SkillRecord skill = result.data();
        out.println();
        out.println(bold(ansi, skill.name()));
        if (skill.title() != null) {
            out.println(italic(ansi, skill.title()));
        }
        out.println("Category: " + skill.category());
        out.println("Size: " + kilobytes(skill.sizeBytes()) + " KB");
        out.println("Tokens: " + skill.tokenCount());
        if (skill.description() != null) {
            out.println();
            out.println(underline(ansi, "Description:"));
            out.println(skill.description());
        }
        out.println();
        out.println(underline(ansi, "Content:"));
        out.println(skill.content());
    }

    static void skillList(final SkillListResult result, final PrintWriter out, final Ansi ansi) {
        out.println();
        out.println(bold(ansi, String.format(Locale.ROOT, "Total: %d skills", result.count())));
        if (result.skills().isEmpty()) {
            return;
        }
        final List<String[]> rows = new ArrayList<>();
        for (final SkillSummary skill : result.skills()) {
            rows.add(new String[]{skill.name(), skill.category(), kilobytes(skill.sizeBytes()),
                    String.valueOf(skill.tokenCount())});
        }
        out.println();
        printTable(out, ansi, new String[]{"name", "category", "size-kb", "tokens"}, rows);
        out.println();
    }

    static void skillSearchResults(final SkillSearchResults result, final PrintWriter out, final Ansi ansi) {
        out.println();
        out.println(bold(ansi, String.format(Locale.ROOT, "Found %d skills matching \"%s\"",
                result.count(), result.query())));
        printSkillHits(out, ansi, result.skills());
    }

    static void prompt(final PromptResult result, final PrintWriter out, final Ansi ansi) {
        final PromptResult.PromptView prompt = result.data();
        out.println();
        out.println(bold(ansi, prompt.name()));
        if (prompt.title() != null) {
            out.println(italic(ansi, prompt.title()));
        }
        if (prompt.author() != null) {
            out.println("Author: " + prompt.author());
        }
        if (prompt.description() != null) {
            out.println("Description: " + prompt.description());
        }
        out.println("Size: " + kilobytes(prompt.sizeBytes()) + " KB");
        out.println("Tokens: " + prompt.tokenCount());
        out.println("Updated: " + prompt.updatedAt());

        printPositionedSkills(out, ansi, "Embedded Skills:", prompt.embeddedFragments());
        printPositionedSkills(out, ansi, "References:", prompt.references());

        out.println();
        out.println(underline(ansi, "Content Preview:"));
        out.println(preview(prompt.content()));
    }

    static void promptList(final PromptListResult result, final PrintWriter out, final Ansi ansi) {
        out.println();
        out.println(bold(ansi, String.format(Locale.ROOT, "Total: %d prompts", result.count())));
        if (result.prompts().isEmpty()) {
            return;
        }
        final List<String[]> rows = new ArrayList<>();
        for (final PromptSummary prompt : result.prompts()) {
            rows.add(new String[]{prompt.name(), kilobytes(prompt.sizeBytes()), String.valueOf(prompt.tokenCount())});
        }
        out.println();
        printTable(out, ansi, new String[]{"name", "size-kb", "tokens"}, rows);
        out.println();
    }

    static void promptSearchResults(final PromptSearchResults result, final PrintWriter out, final Ansi ansi) {
        out.println();
        out.println(bold(ansi, String.format(Locale.ROOT, "Found %d prompts matching \"%s\"",
                result.count(), result.query())));
        printPromptHits(out, ansi, result.prompts());
    }

    static void searchResults(final SearchResults result, final PrintWriter out, final Ansi ansi) {
        if (result.skills().isEmpty() && result.prompts().isEmpty()) {
            out.println("No results found.");
            return;
        }
        if (!result.skills().isEmpty()) {
            out.println();
            out.println(bold(ansi, String.format(Locale.ROOT, "Found %d skills", result.skillCount())));
            printSkillHits(out, ansi, result.skills());
        }
        if (!result.prompts().isEmpty()) {
            out.println();
            out.println(bold(ansi, String.format(Locale.ROOT, "Found %d prompts", result.promptCount())));
            printPromptHits(out, ansi, result.prompts());
        }
    }

    static void stats(final StatsResult result, final PrintWriter out, final Ansi ansi) {
        final StatsResult.Configuration config = result.configuration();
        final StatsResult.Database db = result.database();

        out.println();
        out.println(bold(ansi, "Database Statistics"));
        out.println();
        out.println(underline(ansi, "Configuration:"));
        out.println("  Database: " + config.databasePath());
        out.println("  Project root: " + config.projectRoot());
        out.println("  Skills directory: " + config.skillsDirectory());
        out.println("  Prompts directory: " + config.promptsDirectory());
        out.println("  Prompt configs directory: " + config.promptConfigsDirectory());
        out.println("  Auto-migrate: " + config.autoMigrate());
        out.println("  Max results: " + config.maxResults());
        out.println("  Output format: " + (config.outputFormat() != null ? config.outputFormat() : "json"));

        out.println();
        out.println(underline(ansi, "Database:"));
        out.println("  Schema version: " + db.schemaVersion());
        out.println("  Skills: " + db.skills());
        out.println("  Prompts: " + db.prompts());
        out.println("  Categories: " + db.categories());
        out.println("  Total size: " + kilobytes(db.totalSizeBytes()) + " KB");
        out.println("  Total tokens: " + db.totalTokens());

        if (!result.categoryBreakdown().isEmpty()) {
            out.println();
            out.println(underline(ansi, "Skills by Category:"));
            printTable(out, ansi, new String[]{"category", "count"}, categoryRows(result.categoryBreakdown()));
            out.println();
        }
    }

    static void categoryList(final CategoryListResult result, final PrintWriter out, final Ansi ansi) {
        out.println();
        out.println(bold(ansi, String.format(Locale.ROOT, "Total: %d categories", result.count())));
        if (result.categories().isEmpty()) {
            return;
        }
        out.println();
        printTable(out, ansi, new String[]{"category", "count"}, categoryRows(result.categories()));
        out.println();
    }

    static void syncSummary(final SyncSummaryResult result, final PrintWriter out, final Ansi ansi) {
        out.println();
        out.println(bold(ansi, String.format(Locale.ROOT, "Synced %d files in %d ms", result.total(),
                result.elapsedMs())));
        out.println("  Inserted: " + result.inserted());
        out.println("  Updated: " + result.updated());
        out.println("  Skipped: " + result.skipped());
        out.println("  Errors: " + result.errors());
        out.println("  Prompts linked: " + result.promptsLinked());
        out.println("  Skill associations: " + result.skillAssociations());
        if (!result.warnings().isEmpty()) {
            out.println();
            out.println(underline(ansi, "Warnings:"));
            for (final String warning : result.warnings()) {
                out.println("  " + warning);
            }
        }
    }

    private static void printSkillHits(final PrintWriter out, final Ansi ansi, final List<SkillHit> hits) {
        if (hits.isEmpty()) {
            return;
        }
        out.println();
        for (final SkillHit hit : hits) {
            out.println(bold(ansi, "• " + hit.name()) + styled(ansi, " (" + hit.category() + ")", Style.faint));
            if (hit.snippet() != null) {
                out.println("  " + hit.snippet());
            }
            out.println();
        }
    }

    private static void printPromptHits(final PrintWriter out, final Ansi ansi, final List<PromptHit> hits) {
        if (hits.isEmpty()) {
            return;
        }
        out.println();
        for (final PromptHit hit : hits) {
            out.println(bold(ansi, "• " + hit.name()));
            if (hit.snippet() != null) {
                out.println("  " + hit.snippet());
            }
            out.println();
        }
    }

    private static void printPositionedSkills(final PrintWriter out, final Ansi ansi, final String heading,
                                              final List<PromptResult.PositionedSkill> skills) {
        if (skills.isEmpty()) {
            return;
        }
        out.println();
        out.println(underline(ansi, heading));
        for (final PromptResult.PositionedSkill skill : skills) {
            out.println("  " + skill.position() + ". [" + skill.category() + "] " + skill.name());
        }
    }

    private static List<String[]> categoryRows(final List<CategoryCount> categories) {
        final List<String[]> rows = new ArrayList<>();
        for (final CategoryCount category : categories) {
            rows.add(new String[]{category.category(), String.valueOf(category.count())});
        }
        return rows;
    }

    /**
     * Print rows as aligned columns, each column as wide as its widest cell plus padding.
     * Cells are padded before styling, so escape sequences never affect the alignment.
     */
    static void printTable(final PrintWriter out, final Ansi ansi, final String[] headers, final List<String[]> rows) {
        final int[] widths = new int[headers.length];
        for (int i = 0; i < headers.length; i++) {
            widths[i] = headers[i].length();
        }
        for (final String[] row : rows) {
            for (int i = 0; i < row.length; i++) {
                widths[i] = Math.max(widths[i], row[i] == null ? 0 : row[i].length());
            }
        }
        for (int i = 0; i < widths.length; i++) {
            widths[i] += 3;
        }

        out.println(bold(ansi, formatRow(headers, widths)));
        for (final String[] row : rows) {
            out.println(formatRow(row, widths));
        }
    }

    private static String formatRow(final String[] cells, final int[] widths) {
        final StringBuilder line = new StringBuilder("  ");
        for (int i = 0; i < cells.length; i++) {
            final String cell = cells[i] == null ? "" : cells[i];
            line.append(cell);
            if (i < cells.length - 1) {
                line.append(" ".repeat(widths[i] - cell.length()));
            }
        }
        return line.toString();
    }

    static String preview(final String content) {
        if (content == null) {
            return "";
        }
        return content.length() > CONTENT_PREVIEW_LENGTH
                ? content.substring(0, CONTENT_PREVIEW_LENGTH) + "..."
                : content;
    }

    static String kilobytes(final long bytes) {
        return String.format(Locale.ROOT, "%.1f", bytes / 1024.0);
    }

    private static String bold(final Ansi ansi, final String text) {
        return styled(ansi, text, Style.bold);
    }

    private static String italic(final Ansi ansi, final String text) {
        return styled(ansi, text, Style.italic);
    }

    private static String underline(final Ansi ansi, final String text) {
        return styled(ansi, text, Style.underline);
    }

    /**
     * Wrap text in the escape codes of a style. The text is never parsed as picocli markup,
     * so names and titles containing {@code @|} or {@code |@} print verbatim.
     */
    private static String styled(final Ansi ansi, final String text, final Style style) {
        if (!ansi.enabled()) {
            return text;
        }
        return style.on() + text + style.off();
    }
}
