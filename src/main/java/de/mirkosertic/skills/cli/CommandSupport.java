package de.mirkosertic.skills.cli;

import de.mirkosertic.skills.config.ApplicationConfig;
import de.mirkosertic.skills.db.SchemaMigrator;
import de.mirkosertic.skills.db.SkillsDatabase;
import de.mirkosertic.skills.output.OutputDispatcher;
import de.mirkosertic.skills.output.OutputFormat;
import de.mirkosertic.skills.output.TaggedResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.sql.SQLException;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Base class of the leaf commands.
 * <p>
 * Status lines (INFO, SUCCESS, ERROR) go to stderr, results go to stdout, so stdout stays
 * parseable JSON. Only this layer decides about exit codes.
 */
abstract class CommandSupport implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(CommandSupport.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    @Spec
    CommandSpec spec;

    /**
     * The command's work. Exceptions are turned into an ERROR line and exit code 1 by the
     * execution exception handler.
     */
    protected abstract int execute() throws Exception;

    @Override
    public final Integer call() throws Exception {
        final int exitCode = execute();
        context().eventLog().info("command.finished", Map.of(
                "command", spec.qualifiedName(),
                "exitCode", exitCode));
        return exitCode;
    }

    protected SkillsCommand root() {
        return (SkillsCommand) spec.root().userObject();
    }

    protected CliContext context() {
        return root().context();
    }

    protected ApplicationConfig config() {
        return root().config();
    }

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }

    /**
     * Open the configured database. Pending migrations are applied when
     * {@code database.auto-migrate} is enabled. The caller closes the database.
     */
    protected SkillsDatabase openDatabase() throws IOException, SQLException {
        final SkillsDatabase database = new SkillsDatabase(config().getDatabasePath());
        database.open();
        if (config().isAutoMigrate()) {
            try {
                new SchemaMigrator(database).migrate();
            } catch (final SQLException | RuntimeException e) {
                database.close();
                throw e;
            }
        }
        return database;
    }

    protected void write(final TaggedResult result, final OutputOptions options) {
        final OutputFormat format = OutputFormat.resolve(options.json, options.human, config().getOutputFormat());
        logger.debug("Writing {} as {}", result.type(), format);
        OutputDispatcher.withDefaultFormatters(out(), context().ansi()).write(result, format);
    }

    /**
     * @return false after printing {@code message} as an error when the value is blank
     */
    protected boolean requireNonBlank(final String value, final String message) {
        if (value == null || value.isBlank()) {
            error(message);
            return false;
        }
        return true;
    }

    protected void info(final String message) {
        status("@|bold,blue INFO:|@ ", message);
    }

    protected void success(final String message) {
        status("@|bold,green SUCCESS:|@ ", message);
    }

    protected void error(final String message) {
        status("@|bold,red ERROR:|@ ", message);
    }

    private void status(final String label, final String message) {
        err().println(context().ansi().string(label) + message);
        err().flush();
    }
}
