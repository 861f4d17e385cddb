package de.mirkosertic.skills.output;

/**
 * A command result that can be written by the {@link OutputDispatcher}. The tag selects the
 * human formatter and is written as the {@code type} field of the JSON output.
 */
public interface TaggedResult {

    String type();
}
