package de.mirkosertic.skills.cli;

import de.mirkosertic.skills.db.FragmentRepository;
import de.mirkosertic.skills.db.PromptRepository;
import de.mirkosertic.skills.db.SchemaMigrator;
import de.mirkosertic.skills.db.SkillRepository;
import de.mirkosertic.skills.db.SkillsDatabase;
import de.mirkosertic.skills.output.dto.StatsResult;
import de.mirkosertic.skills.output.dto.SyncSummaryResult;
import de.mirkosertic.skills.search.SearchService;
import de.mirkosertic.skills.sync.DocumentReader;
import de.mirkosertic.skills.sync.DocumentUpserter;
import de.mirkosertic.skills.sync.FileScanner;
import de.mirkosertic.skills.sync.FragmentLinker;
import de.mirkosertic.skills.sync.SyncOrchestrator;
import de.mirkosertic.skills.sync.SyncSummary;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Database lifecycle commands.
 */
@Command(name = "db",
        description = "Initialize, sync, reset and inspect the database.",
        subcommands = {
                DbCommand.InitCommand.class,
                DbCommand.SyncCommand.class,
                DbCommand.ResetCommand.class,
                DbCommand.StatsCommand.class
        })
public class DbCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    @Command(name = "init", description = "Create the database and write the default user configuration.")
    public static class InitCommand extends CommandSupport {

        @Override
        protected int execute() throws Exception {
            if (config().writeDefaultUserConfig()) {
                info("Wrote default configuration");
            }
            info("Initializing database at " + config().getDatabasePath());
            try (final SkillsDatabase database = new SkillsDatabase(config().getDatabasePath())) {
                database.open();
                new SchemaMigrator(database).migrate();
            }
            success("Database initialized successfully");
            return EXIT_OK;
        }
    }

    @Command(name = "sync", description = "Sync skills and prompts from the project into the database.")
    public static class SyncCommand extends CommandSupport {

        @Mixin
        OutputOptions output;

        @Override
        protected int execute() throws Exception {
            info("Syncing skills and prompts from " + config().getProjectRoot());
            try (final SkillsDatabase database = openDatabase()) {
                final SkillRepository skills = new SkillRepository(database);
                final PromptRepository prompts = new PromptRepository(database);
                final SyncOrchestrator orchestrator = new SyncOrchestrator(
                        new FileScanner(),
                        new DocumentReader(config().getSkillsDirectory(), config().getPromptsDirectory()),
                        new DocumentUpserter(skills, prompts, context().clock()),
                        new FragmentLinker(database, skills, prompts, new FragmentRepository(),
                                config().getProjectRoot()),
                        context().eventLog(),
                        config());

                final SyncSummary summary = orchestrator.syncAll();
                write(SyncSummaryResult.of(summary), output);
                if (summary.hasErrors()) {
                    error("Sync finished with " + summary.errors() + " error(s)");
                } else {
                    success("Sync complete");
                }
            }
            return EXIT_OK;
        }
    }

    @Command(name = "reset", description = "Drop all data and recreate the schema.")
    public static class ResetCommand extends CommandSupport {

        @Option(names = {"-f", "--force"}, description = "Confirm that all data will be deleted.")
        boolean force;

        @Override
        protected int execute() throws Exception {
            if (!force) {
                error("This will DELETE all data in the database!");
                err().println("Use --force to confirm.");
                err().flush();
                return EXIT_FAILURE;
            }
            info("Resetting database...");
            try (final SkillsDatabase database = new SkillsDatabase(config().getDatabasePath())) {
                database.open();
                new SchemaMigrator(database).reset();
            }
            success("Database reset complete");
            return EXIT_OK;
        }
    }

    @Command(name = "stats", description = "Show configuration and database statistics.")
    public static class StatsCommand extends CommandSupport {

        @Mixin
        OutputOptions output;

        @Override
        protected int execute() throws Exception {
            try (final SkillsDatabase database = openDatabase()) {
                final SearchService search = new SearchService(database, config().getMaxResults());
                final int schemaVersion = new SchemaMigrator(database).getCurrentVersion();
                write(StatsResult.of(config(), schemaVersion, search.stats()), output);
            }
            return EXIT_OK;
        }
    }
}
