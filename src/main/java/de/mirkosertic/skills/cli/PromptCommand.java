package de.mirkosertic.skills.cli;

import de.mirkosertic.skills.db.PromptRecord;
import de.mirkosertic.skills.db.SkillsDatabase;
import de.mirkosertic.skills.output.dto.PromptListResult;
import de.mirkosertic.skills.output.dto.PromptResult;
import de.mirkosertic.skills.output.dto.PromptSearchResults;
import de.mirkosertic.skills.search.PromptDetails;
import de.mirkosertic.skills.search.PromptHit;
import de.mirkosertic.skills.search.SearchService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.List;
import java.util.Optional;

@Command(name = "prompt",
        description = "Search, list and show prompts.",
        subcommands = {
                PromptCommand.SearchPromptsCommand.class,
                PromptCommand.ListPromptsCommand.class,
                PromptCommand.ShowPromptCommand.class
        })
public class PromptCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    @Command(name = "search", description = "Full-text search over prompts.")
    public static class SearchPromptsCommand extends CommandSupport {

        @Parameters(index = "0", arity = "0..1", paramLabel = "QUERY", description = "FTS5 query.")
        String query;

        @Option(names = {"-n", "--max-results"}, description = "Maximum number of results.")
        Integer maxResults;

        @Mixin
        OutputOptions output;

        @Override
        protected int execute() throws Exception {
            if (!requireNonBlank(query, "Search query cannot be empty")) {
                return EXIT_FAILURE;
            }
            info("Searching prompts for: " + query);
            try (final SkillsDatabase database = openDatabase()) {
                final List<PromptHit> hits = new SearchService(database, config().getMaxResults())
                        .searchPrompts(query, maxResults);
                write(PromptSearchResults.of(query, hits), output);
            }
            return EXIT_OK;
        }
    }

    @Command(name = "list", description = "List prompts ordered by name.")
    public static class ListPromptsCommand extends CommandSupport {

        @Option(names = "--limit", description = "Maximum number of prompts (default: ${DEFAULT-VALUE}).",
                defaultValue = "100")
        int limit;

        @Option(names = "--offset", description = "Number of prompts to skip (default: ${DEFAULT-VALUE}).",
                defaultValue = "0")
        int offset;

        @Mixin
        OutputOptions output;

        @Override
        protected int execute() throws Exception {
            try (final SkillsDatabase database = openDatabase()) {
                final List<PromptRecord> prompts = new SearchService(database, config().getMaxResults())
                        .listPrompts(limit, offset);
                write(PromptListResult.of(prompts), output);
            }
            return EXIT_OK;
        }
    }

    @Command(name = "show", description = "Show a prompt with its embedded and referenced skills.")
    public static class ShowPromptCommand extends CommandSupport {

        @Parameters(index = "0", arity = "0..1", paramLabel = "NAME", description = "Prompt name.")
        String name;

        @Mixin
        OutputOptions output;

        @Override
        protected int execute() throws Exception {
            if (!requireNonBlank(name, "Prompt name cannot be empty")) {
                return EXIT_FAILURE;
            }
            try (final SkillsDatabase database = openDatabase()) {
                final Optional<PromptDetails> prompt = new SearchService(database, config().getMaxResults())
                        .getPromptByName(name);
                if (prompt.isEmpty()) {
                    error("Prompt not found: " + name);
                    return EXIT_FAILURE;
                }
                write(PromptResult.of(prompt.get()), output);
            }
            return EXIT_OK;
        }
    }
}
