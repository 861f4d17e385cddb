package de.mirkosertic.skills.cli;

import de.mirkosertic.skills.db.SkillsDatabase;
import de.mirkosertic.skills.output.dto.CategoryListResult;
import de.mirkosertic.skills.search.SearchService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(name = "category",
        description = "Inspect skill categories.",
        subcommands = CategoryCommand.ListCategoriesCommand.class)
public class CategoryCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    @Command(name = "list", description = "List skill categories with their skill counts.")
    public static class ListCategoriesCommand extends CommandSupport {

        @Mixin
        OutputOptions output;

        @Override
        protected int execute() throws Exception {
            try (final SkillsDatabase database = openDatabase()) {
                write(CategoryListResult.of(
                        new SearchService(database, config().getMaxResults()).listCategories()), output);
            }
            return EXIT_OK;
        }
    }
}
