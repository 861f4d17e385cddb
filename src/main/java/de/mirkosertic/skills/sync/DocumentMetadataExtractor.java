package de.mirkosertic.skills.sync;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure functions that derive metadata from a document's text and location.
 */
public final class DocumentMetadataExtractor {

    private static final Logger logger = LoggerFactory.getLogger(DocumentMetadataExtractor.class);

    static final String FRONTMATTER_DELIMITER = "---";
    static final String UNCATEGORIZED = "uncategorized";

    private DocumentMetadataExtractor() {
    }

    /**
     * Frontmatter split off a document. {@code metadata} is null when the document has no
     * valid frontmatter block, in which case {@code body} is the unchanged input.
     */
    public record Frontmatter(@Nullable Map<String, Object> metadata, String body) {

        public @Nullable String getString(final String key) {
            if (metadata == null) {
                return null;
            }
            final Object value = metadata.get(key);
            return value == null ? null : value.toString();
        }
    }

    /**
     * Category and name derived from a file path.
     */
    public record PathClassification(String category, String name) {
    }

    /**
     * SHA-256 over the UTF-8 bytes of the text, as 64 lowercase hex characters.
     */
    public static String fingerprint(final String text) {
        final MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
        final byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
        final StringBuilder hexString = new StringBuilder();
        for (final byte b : hash) {
            final String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }

    /**
     * Split a leading {@code ---} delimited YAML block off the text.
     */
    public static Frontmatter extractFrontmatter(final String content) {
        final String[] lines = content.split("\\R", -1);
        if (lines.length == 0 || !FRONTMATTER_DELIMITER.equals(lines[0])) {
            return new Frontmatter(null, content);
        }

        int end = -1;
        for (int i = 1; i < lines.length; i++) {
            if (FRONTMATTER_DELIMITER.equals(lines[i])) {
                end = i;
                break;
            }
        }
        if (end < 0) {
            return new Frontmatter(null, content);
        }

        final String yamlText = String.join("\n", List.of(lines).subList(1, end));
        final String body = String.join("\n", List.of(lines).subList(end + 1, lines.length));

        final Object parsed;
        try {
            parsed = new Yaml().load(yamlText);
        } catch (final YAMLException e) {
            logger.debug("Ignoring unparsable frontmatter: {}", e.getMessage());
            return new Frontmatter(null, content);
        }

        if (parsed == null) {
            return new Frontmatter(new LinkedHashMap<>(), body);
        }
        if (!(parsed instanceof Map<?, ?> map)) {
            return new Frontmatter(null, content);
        }
        final Map<String, Object> metadata = new LinkedHashMap<>();
        for (final Map.Entry<?, ?> entry : map.entrySet()) {
            metadata.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return new Frontmatter(metadata, body);
    }

    /**
     * The category is the path segments between the first {@code rootMarker} segment and the
     * filename, joined with {@code /}. The name is the filename without its extension.
     */
    public static PathClassification classifyPath(final Path path, final String rootMarker) {
        final List<String> segments = new ArrayList<>();
        for (final Path segment : path) {
            segments.add(segment.toString());
        }
        final String name = documentName(path);

        final int markerIndex = segments.subList(0, Math.max(segments.size() - 1, 0)).indexOf(rootMarker);
        if (markerIndex < 0 || markerIndex >= segments.size() - 2) {
            return new PathClassification(UNCATEGORIZED, name);
        }
        final String category = String.join("/", segments.subList(markerIndex + 1, segments.size() - 1));
        return new PathClassification(category, name);
    }

    /**
     * Classify a file by its location below {@code rootDirectory}. Directories above the root
     * never become part of the category, even when one of them has the root's name. Files
     * outside the root fall back to {@link #classifyPath(Path, String)} with the root's name
     * as marker.
     */
    public static PathClassification classifyBelow(final Path path, final Path rootDirectory) {
        final Path root = rootDirectory.toAbsolutePath().normalize();
        final Path file = path.toAbsolutePath().normalize();
        final String marker = root.getFileName() == null ? "" : root.getFileName().toString();
        if (file.startsWith(root) && !file.equals(root)) {
            return classifyPath(Paths.get(marker).resolve(root.relativize(file)), marker);
        }
        return classifyPath(file, marker);
    }

    /**
     * The filename without its last extension.
     */
    public static String documentName(final Path path) {
        final Path fileNamePath = path.getFileName();
        final String fileName = fileNamePath == null ? path.toString() : fileNamePath.toString();
        final int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /**
     * Rough token count, four characters per token.
     */
    public static int estimateTokens(final @Nullable String text) {
        return text == null ? 0 : text.length() / 4;
    }
}
