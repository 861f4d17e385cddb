package de.mirkosertic.skills.cli;

import de.mirkosertic.skills.db.SkillRecord;
import de.mirkosertic.skills.db.SkillsDatabase;
import de.mirkosertic.skills.output.dto.SkillListResult;
import de.mirkosertic.skills.output.dto.SkillResult;
import de.mirkosertic.skills.output.dto.SkillSearchResults;
import de.mirkosertic.skills.search.SearchService;
import de.mirkosertic.skills.search.SkillHit;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.List;
import java.util.Optional;

@Command(name = "skill",
        description = "Search, list and show skills.",
        subcommands = {
                SkillCommand.SearchSkillsCommand.class,
                SkillCommand.ListSkillsCommand.class,
                SkillCommand.ShowSkillCommand.class
        })
public class SkillCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    @Command(name = "search", description = "Full-text search over skills.")
    public static class SearchSkillsCommand extends CommandSupport {

        @Parameters(index = "0", arity = "0..1", paramLabel = "QUERY", description = "FTS5 query.")
        String query;

        @Option(names = {"-c", "--category"}, description = "Only return skills of this category.")
        String category;

        @Option(names = {"-n", "--max-results"}, description = "Maximum number of results.")
        Integer maxResults;

        @Mixin
        OutputOptions output;

        @Override
        protected int execute() throws Exception {
            if (!requireNonBlank(query, "Search query cannot be empty")) {
                return EXIT_FAILURE;
            }
            info("Searching skills for: " + query);
            try (final SkillsDatabase database = openDatabase()) {
                final List<SkillHit> hits = new SearchService(database, config().getMaxResults())
                        .searchSkills(query, maxResults, category);
                write(SkillSearchResults.of(query, category, hits), output);
            }
            return EXIT_OK;
        }
    }

    @Command(name = "list", description = "List skills ordered by category and name.")
    public static class ListSkillsCommand extends CommandSupport {

        @Option(names = {"-c", "--category"}, description = "Only list skills of this category.")
        String category;

        @Option(names = "--limit", description = "Maximum number of skills (default: ${DEFAULT-VALUE}).",
                defaultValue = "100")
        int limit;

        @Option(names = "--offset", description = "Number of skills to skip (default: ${DEFAULT-VALUE}).",
                defaultValue = "0")
        int offset;

        @Mixin
        OutputOptions output;

        @Override
        protected int execute() throws Exception {
            try (final SkillsDatabase database = openDatabase()) {
                final List<SkillRecord> skills = new SearchService(database, config().getMaxResults())
                        .listSkills(category, limit, offset);
                write(SkillListResult.of(category, skills), output);
            }
            return EXIT_OK;
        }
    }

    @Command(name = "show", description = "Show a skill including its content.")
    public static class ShowSkillCommand extends CommandSupport {

        @Parameters(index = "0", arity = "0..1", paramLabel = "NAME", description = "Skill name.")
        String name;

        @Option(names = {"-c", "--category"}, description = "Category of the skill, if the name is ambiguous.")
        String category;

        @Mixin
        OutputOptions output;

        @Override
        protected int execute() throws Exception {
            if (!requireNonBlank(name, "Skill name cannot be empty")) {
                return EXIT_FAILURE;
            }
            try (final SkillsDatabase database = openDatabase()) {
                final Optional<SkillRecord> skill = new SearchService(database, config().getMaxResults())
                        .getSkillByName(name, category);
                if (skill.isEmpty()) {
                    error("Skill not found: " + name + (category != null ? " in category " + category : ""));
                    return EXIT_FAILURE;
                }
                write(new SkillResult(skill.get()), output);
            }
            return EXIT_OK;
        }
    }
}
