package de.mirkosertic.skills.cli;

import picocli.CommandLine.Option;

/**
 * The output mode flags shared by every command that writes a result.
 */
public class OutputOptions {

    @Option(names = "--json", description = "Write the result as JSON (default).")
    boolean json;

    @Option(names = "--human", description = "Write the result as human readable text.")
    boolean human;
}
