package de.mirkosertic.skills.output;

import picocli.CommandLine.Help.Ansi;

import java.io.PrintWriter;

/**
 * Renders one result type for a terminal.
 */
@FunctionalInterface
public interface HumanFormatter<T extends TaggedResult> {

    void format(T result, PrintWriter out, Ansi ansi);
}
