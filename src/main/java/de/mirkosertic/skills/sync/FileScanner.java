package de.mirkosertic.skills.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds the documents of one type below a directory.
 */
public class FileScanner {

    private static final Logger logger = LoggerFactory.getLogger(FileScanner.class);

    /**
     * All regular files below {@code directory} whose name ends with {@code extension},
     * sorted by their full path. A missing directory yields an empty list.
     */
    public List<Path> scan(final Path directory, final String extension) {
        if (!Files.exists(directory) || !Files.isDirectory(directory)) {
            logger.debug("Skipping non-existent or non-directory path: {}", directory);
            return List.of();
        }

        try (final Stream<Path> paths = Files.walk(directory)) {
            return paths.filter(Files::isRegularFile)
                    .filter(file -> file.getFileName().toString().endsWith(extension))
                    .map(file -> file.toAbsolutePath().normalize())
                    .sorted(Comparator.comparing(Path::toString))
                    .collect(Collectors.toList());
        } catch (final IOException | UncheckedIOException e) {
            logger.error("Error walking directory {}", directory, e);
            return List.of();
        }
    }
}
