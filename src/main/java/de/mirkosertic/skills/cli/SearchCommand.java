package de.mirkosertic.skills.cli;

import de.mirkosertic.skills.db.SkillsDatabase;
import de.mirkosertic.skills.output.dto.SearchResults;
import de.mirkosertic.skills.search.PromptHit;
import de.mirkosertic.skills.search.SearchService;
import de.mirkosertic.skills.search.SkillHit;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * Searches skills, prompts or both with one query.
 */
@Command(name = "search", description = "Full-text search over skills and prompts.")
public class SearchCommand extends CommandSupport {

    enum SearchType {
        SKILLS,
        PROMPTS,
        ALL
    }

    @Parameters(index = "0", arity = "0..1", paramLabel = "QUERY", description = "FTS5 query.")
    String query;

    @Option(names = {"-c", "--category"}, description = "Only return skills of this category.")
    String category;

    @Option(names = {"-n", "--max-results"}, description = "Maximum number of results per document type.")
    Integer maxResults;

    @Option(names = {"-t", "--type"}, defaultValue = "all",
            description = "What to search: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE}).")
    SearchType type;

    @Mixin
    OutputOptions output;

    @Override
    protected int execute() throws Exception {
        if (!requireNonBlank(query, "Search query cannot be empty")) {
            return EXIT_FAILURE;
        }
        info("Searching for: " + query);
        try (final SkillsDatabase database = openDatabase()) {
            final SearchService search = new SearchService(database, config().getMaxResults());
            final List<SkillHit> skills = type == SearchType.PROMPTS
                    ? List.of()
                    : search.searchSkills(query, maxResults, category);
            final List<PromptHit> prompts = type == SearchType.SKILLS
                    ? List.of()
                    : search.searchPrompts(query, maxResults);
            write(SearchResults.of(query, category, skills, prompts), output);
        }
        return EXIT_OK;
    }
}
