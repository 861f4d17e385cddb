package de.mirkosertic.skills;

import de.mirkosertic.skills.cli.CliContext;
import de.mirkosertic.skills.cli.SkillsCommand;
import de.mirkosertic.skills.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Main entry point of the skills indexer CLI.
 */
public class SkillsApplication {

    private static final Logger logger = LoggerFactory.getLogger(SkillsApplication.class);

    private SkillsApplication() {
    }

    public static void main(final String[] args) {
        // Configure logging FIRST, before any other code that might log
        LoggingConfigurator.configure(Boolean.parseBoolean(System.getenv(LoggingConfigurator.ENV_LOG_TO_FILE)));

        final EventLog eventLog = new EventLog();
        eventLog.start();
        final int exitCode;
        try {
            exitCode = run(args, System.out, System.err, CliContext.defaults(eventLog));
        } finally {
            eventLog.stop();
        }
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Run one CLI invocation with the given streams.
     *
     * @return the process exit code
     */
    public static int run(final String[] args, final PrintStream out, final PrintStream err,
                          final CliContext context) {
        final CommandLine commandLine = createCommandLine(context);
        commandLine.setOut(new PrintWriter(out, true, StandardCharsets.UTF_8));
        commandLine.setErr(new PrintWriter(err, true, StandardCharsets.UTF_8));
        return commandLine.execute(args);
    }

    static CommandLine createCommandLine(final CliContext context) {
        final CommandLine commandLine = new CommandLine(new SkillsCommand(context));
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExecutionExceptionHandler((exception, cmd, parseResult) -> {
            logger.debug("Command {} failed", cmd.getCommandName(), exception);
            context.eventLog().error("command.failed",
                    Map.of("command", cmd.getCommandSpec().qualifiedName()), exception);
            cmd.getErr().println(context.ansi().string("@|bold,red ERROR:|@ ") + describe(exception));
            cmd.getErr().flush();
            return 1;
        });
        return commandLine;
    }

    private static String describe(final Exception exception) {
        final String message = exception.getMessage();
        return message != null ? message : exception.getClass().getSimpleName();
    }
}
