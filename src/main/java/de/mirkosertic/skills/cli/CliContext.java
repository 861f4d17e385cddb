package de.mirkosertic.skills.cli;

import de.mirkosertic.skills.EventLog;
import de.mirkosertic.skills.config.ApplicationConfig;
import picocli.CommandLine.Help.Ansi;

import java.time.Clock;
import java.util.function.Supplier;

/**
 * Collaborators shared by all commands of one invocation.
 *
 * @param configLoader loads the configuration on first use
 * @param eventLog     the started event log of the process
 * @param clock        source of the created/updated timestamps written by sync
 * @param ansi         whether terminal styling is emitted
 */
public record CliContext(
        Supplier<ApplicationConfig> configLoader,
        EventLog eventLog,
        Clock clock,
        Ansi ansi
) {

    public static CliContext defaults(final EventLog eventLog) {
        return new CliContext(ApplicationConfig::load, eventLog, Clock.systemUTC(), Ansi.AUTO);
    }
}
