package de.mirkosertic.skills.sync;

import de.mirkosertic.skills.db.PromptRecord;
import de.mirkosertic.skills.db.SkillRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads skill, prompt and prompt descriptor files into unsaved records.
 */
public class DocumentReader {

    private static final Logger logger = LoggerFactory.getLogger(DocumentReader.class);

    static final String COMBINED_HASH_SEPARATOR = "\n---\n";

    private final Path skillsDirectory;
    private final Path promptsDirectory;

    public DocumentReader(final Path skillsDirectory, final Path promptsDirectory) {
        this.skillsDirectory = skillsDirectory;
        this.promptsDirectory = promptsDirectory;
    }

    public SkillRecord readSkill(final Path file) throws IOException {
        final String content = Files.readString(file, StandardCharsets.UTF_8);
        final DocumentMetadataExtractor.Frontmatter frontmatter = DocumentMetadataExtractor.extractFrontmatter(content);
        final DocumentMetadataExtractor.PathClassification classification =
                DocumentMetadataExtractor.classifyBelow(file, skillsDirectory);

        return SkillRecord.unsaved(
                file.toString(),
                classification.category(),
                classification.name(),
                frontmatter.getString("title"),
                frontmatter.getString("description"),
                content,
                DocumentMetadataExtractor.fingerprint(content),
                Files.size(file),
                DocumentMetadataExtractor.estimateTokens(content));
    }

    /**
     * Parse a prompt descriptor. The prompt name falls back to the filename, the fragment list
     * falls back to the legacy {@code skills} key.
     */
    public PromptDescriptor readPromptDescriptor(final Path file) throws IOException {
        final String text = Files.readString(file, StandardCharsets.UTF_8);
        final Object parsed = new Yaml().load(text);
        if (!(parsed instanceof Map<?, ?> config)) {
            throw new IOException("Prompt descriptor is not a YAML mapping: " + file);
        }

        final String fileName = file.getFileName().toString();
        final String fallbackName = fileName.endsWith(".yaml")
                ? fileName.substring(0, fileName.length() - ".yaml".length())
                : fileName;

        final Object fragments = config.containsKey("fragments") ? config.get("fragments") : config.get("skills");

        return new PromptDescriptor(
                file,
                stringOr(config.get("name"), fallbackName),
                stringOr(config.get("title"), null),
                stringOr(config.get("description"), null),
                stringOr(config.get("author"), null),
                stringOr(config.get("date"), null),
                stringList(fragments, file, "fragments"),
                stringList(config.get("references"), file, "references"),
                text);
    }

    /**
     * Build the prompt row of a descriptor from its content file
     * {@code <prompts-dir>/<name>.md}. The hash covers both files.
     */
    public PromptRecord readPrompt(final PromptDescriptor descriptor) throws IOException {
        final Path contentFile = promptsDirectory.resolve(descriptor.name() + ".md").toAbsolutePath().normalize();
        final String content = Files.readString(contentFile, StandardCharsets.UTF_8);

        return PromptRecord.unsaved(
                descriptor.name(),
                contentFile.toString(),
                descriptor.title(),
                descriptor.author(),
                descriptor.description(),
                content,
                DocumentMetadataExtractor.fingerprint(descriptor.text() + COMBINED_HASH_SEPARATOR + content),
                Files.size(descriptor.path()) + Files.size(contentFile),
                DocumentMetadataExtractor.estimateTokens(content));
    }

    /**
     * Build a prompt row from a standalone Markdown file whose frontmatter supplies the metadata.
     */
    public PromptRecord readPlainPrompt(final Path file) throws IOException {
        final String content = Files.readString(file, StandardCharsets.UTF_8);
        final DocumentMetadataExtractor.Frontmatter frontmatter = DocumentMetadataExtractor.extractFrontmatter(content);
        final String name = DocumentMetadataExtractor.documentName(file);

        return PromptRecord.unsaved(
                name,
                file.toString(),
                frontmatter.getString("title"),
                frontmatter.getString("author"),
                frontmatter.getString("description"),
                content,
                DocumentMetadataExtractor.fingerprint(content),
                Files.size(file),
                DocumentMetadataExtractor.estimateTokens(content));
    }

    private static String stringOr(final Object value, final String fallback) {
        return value == null ? fallback : value.toString();
    }

    private static List<String> stringList(final Object value, final Path file, final String key) {
        final List<String> result = new ArrayList<>();
        if (value == null) {
            return result;
        }
        if (!(value instanceof List<?> list)) {
            logger.warn("Ignoring '{}' in {}: expected a list", key, file);
            return result;
        }
        for (final Object entry : list) {
            if (entry != null) {
                result.add(entry.toString());
            }
        }
        return result;
    }
}
