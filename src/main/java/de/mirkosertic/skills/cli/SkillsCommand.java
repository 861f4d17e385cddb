package de.mirkosertic.skills.cli;

import de.mirkosertic.skills.config.ApplicationConfig;
import de.mirkosertic.skills.config.BuildInfo;
import de.mirkosertic.skills.config.LoggingConfigurator;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ScopeType;
import picocli.CommandLine.Spec;

/**
 * Root command of the CLI.
 */
@Command(name = "skills-indexer",
        mixinStandardHelpOptions = true,
        versionProvider = BuildInfo.class,
        description = "Index Markdown skills and prompts into SQLite and search them.",
        subcommands = {
                DbCommand.class,
                SkillCommand.class,
                PromptCommand.class,
                SearchCommand.class,
                CategoryCommand.class
        })
public class SkillsCommand implements Runnable {

    private final CliContext context;
    private ApplicationConfig config;

    @Spec
    CommandSpec spec;

    @Option(names = "--verbose", scope = ScopeType.INHERIT, description = "Log debug output to stderr.")
    void setVerbose(final boolean verbose) {
        if (verbose) {
            LoggingConfigurator.enableVerbose();
        }
    }

    public SkillsCommand(final CliContext context) {
        this.context = context;
    }

    CliContext context() {
        return context;
    }

    /**
     * The configuration, loaded once per invocation.
     */
    ApplicationConfig config() {
        if (config == null) {
            config = context.configLoader().get();
        }
        return config;
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
