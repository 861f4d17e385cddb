package de.mirkosertic.skills.sync;

import de.mirkosertic.skills.EventLog;
import de.mirkosertic.skills.config.ApplicationConfig;
import de.mirkosertic.skills.sync.SyncSummary.DocumentKind;
import de.mirkosertic.skills.sync.SyncSummary.FileResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a complete sync of the project's documents into the database.
 * <p>
 * Three phases run in order, each regardless of failures in the previous one:
 * <ol>
 *   <li>every {@code .md} file below the skills directory is synced as a skill</li>
 *   <li>prompts are synced from the {@code .yaml} descriptors in the prompt configs directory,
 *       or, when there are none, from the {@code .md} files in the prompts directory</li>
 *   <li>the fragment and reference associations of every descriptor are rebuilt</li>
 * </ol>
 */
public class SyncOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(SyncOrchestrator.class);

    private final FileScanner scanner;
    private final DocumentReader reader;
    private final DocumentUpserter upserter;
    private final FragmentLinker linker;
    private final EventLog eventLog;
    private final Path skillsDirectory;
    private final Path promptsDirectory;
    private final Path promptConfigsDirectory;

    public SyncOrchestrator(final FileScanner scanner, final DocumentReader reader, final DocumentUpserter upserter,
                            final FragmentLinker linker, final EventLog eventLog, final ApplicationConfig config) {
        this.scanner = scanner;
        this.reader = reader;
        this.upserter = upserter;
        this.linker = linker;
        this.eventLog = eventLog;
        this.skillsDirectory = config.getSkillsDirectory();
        this.promptsDirectory = config.getPromptsDirectory();
        this.promptConfigsDirectory = config.getPromptConfigsDirectory();
    }

    public SyncSummary syncAll() {
        final long startTime = System.currentTimeMillis();
        final List<FileResult> results = new ArrayList<>();
        final List<String> warnings = new ArrayList<>();

        syncSkills(results);
        final List<PromptDescriptor> descriptors = syncPrompts(results, warnings);
        final LinkTotals linkTotals = linkFragments(descriptors, warnings);

        final Map<SyncOutcome, Integer> counts = new LinkedHashMap<>();
        for (final SyncOutcome outcome : SyncOutcome.values()) {
            counts.put(outcome, 0);
        }
        for (final FileResult result : results) {
            counts.merge(result.outcome(), 1, Integer::sum);
        }

        final SyncSummary summary = new SyncSummary(
                results,
                counts.get(SyncOutcome.INSERTED),
                counts.get(SyncOutcome.UPDATED),
                counts.get(SyncOutcome.SKIPPED),
                counts.get(SyncOutcome.ERROR),
                linkTotals.promptsLinked(),
                linkTotals.associations(),
                warnings,
                System.currentTimeMillis() - startTime);

        logger.info("Sync complete: {} inserted, {} updated, {} skipped, {} errors in {}ms",
                summary.inserted(), summary.updated(), summary.skipped(), summary.errors(), summary.elapsedMs());
        eventLog.info("sync.completed", Map.of(
                "inserted", summary.inserted(),
                "updated", summary.updated(),
                "skipped", summary.skipped(),
                "errors", summary.errors(),
                "warnings", warnings.size(),
                "elapsedMs", summary.elapsedMs()));
        return summary;
    }

    private void syncSkills(final List<FileResult> results) {
        final List<Path> files = scanner.scan(skillsDirectory, ".md");
        logger.info("Syncing {} skills from {}", files.size(), skillsDirectory);
        for (final Path file : files) {
            final SyncOutcome outcome = upserter.syncSkill(file.toString(), () -> reader.readSkill(file));
            results.add(new FileResult(DocumentKind.SKILL, file.toString(), outcome));
        }
    }

    /**
     * Prompts are keyed by name, so within one run the first file claiming a name wins. Later
     * files with the same name are reported as errors instead of overwriting it.
     *
     * @return the descriptors that were synced, for the linking phase
     */
    private List<PromptDescriptor> syncPrompts(final List<FileResult> results, final List<String> warnings) {
        final List<Path> descriptorFiles = scanner.scan(promptConfigsDirectory, ".yaml");
        final List<PromptDescriptor> descriptors = new ArrayList<>();
        final Map<String, Path> claimedNames = new HashMap<>();

        if (descriptorFiles.isEmpty()) {
            final List<Path> files = scanner.scan(promptsDirectory, ".md");
            logger.info("Syncing {} plain prompts from {}", files.size(), promptsDirectory);
            for (final Path file : files) {
                if (!claimName(claimedNames, DocumentMetadataExtractor.documentName(file), file, warnings)) {
                    results.add(new FileResult(DocumentKind.PROMPT, file.toString(), SyncOutcome.ERROR));
                    continue;
                }
                final SyncOutcome outcome = upserter.syncPrompt(file.toString(), () -> reader.readPlainPrompt(file));
                results.add(new FileResult(DocumentKind.PROMPT, file.toString(), outcome));
            }
            return descriptors;
        }

        logger.info("Syncing {} prompts from {}", descriptorFiles.size(), promptConfigsDirectory);
        for (final Path file : descriptorFiles) {
            final PromptDescriptor descriptor;
            try {
                descriptor = reader.readPromptDescriptor(file);
            } catch (final Exception e) {
                logger.error("Error reading prompt descriptor {}: {}", file, e.getMessage(), e);
                results.add(new FileResult(DocumentKind.PROMPT, file.toString(), SyncOutcome.ERROR));
                continue;
            }
            if (!claimName(claimedNames, descriptor.name(), file, warnings)) {
                results.add(new FileResult(DocumentKind.PROMPT, file.toString(), SyncOutcome.ERROR));
                continue;
            }
            descriptors.add(descriptor);
            final SyncOutcome outcome = upserter.syncPrompt(descriptor.name(), () -> reader.readPrompt(descriptor));
            results.add(new FileResult(DocumentKind.PROMPT, file.toString(), outcome));
        }
        return descriptors;
    }

    private static boolean claimName(final Map<String, Path> claimedNames, final String name, final Path file,
                                     final List<String> warnings) {
        final Path owner = claimedNames.putIfAbsent(name, file);
        if (owner == null) {
            return true;
        }
        final String warning = "Duplicate prompt name " + name + ": " + file + " conflicts with " + owner;
        logger.error(warning);
        warnings.add(warning);
        return false;
    }

    private record LinkTotals(int promptsLinked, int associations) {
    }

    private LinkTotals linkFragments(final List<PromptDescriptor> descriptors, final List<String> warnings) {
        int promptsLinked = 0;
        int associations = 0;
        for (final PromptDescriptor descriptor : descriptors) {
            try {
                final FragmentLinker.LinkResult result = linker.link(descriptor);
                warnings.addAll(result.warnings());
                if (result.linked()) {
                    promptsLinked++;
                    associations += result.embeddedSkills() + result.referenceSkills();
                }
            } catch (final Exception e) {
                final String warning = "Error linking fragments for prompt " + descriptor.name() + ": " + e.getMessage();
                logger.error(warning, e);
                warnings.add(warning);
            }
        }
        return new LinkTotals(promptsLinked, associations);
    }
}
