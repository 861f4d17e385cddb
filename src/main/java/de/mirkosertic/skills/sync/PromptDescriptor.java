package de.mirkosertic.skills.sync;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.List;

/**
 * A parsed prompt configuration file. {@code fragments} and {@code references} hold skill
 * paths relative to the project root.
 */
public record PromptDescriptor(
        Path path,
        String name,
        @Nullable String title,
        @Nullable String description,
        @Nullable String author,
        @Nullable String date,
        List<String> fragments,
        List<String> references,
        String text
) {
}
