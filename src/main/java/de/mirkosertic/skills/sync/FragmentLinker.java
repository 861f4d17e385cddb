package de.mirkosertic.skills.sync;

import de.mirkosertic.skills.db.FragmentRepository;
import de.mirkosertic.skills.db.FragmentRepository.ReferenceKind;
import de.mirkosertic.skills.db.PromptRecord;
import de.mirkosertic.skills.db.PromptRepository;
import de.mirkosertic.skills.db.SkillRecord;
import de.mirkosertic.skills.db.SkillRepository;
import de.mirkosertic.skills.db.SkillsDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rebuilds the fragment and reference rows of a prompt from its descriptor.
 * <p>
 * A prompt gets one embedded fragment {@code <prompt>-embedded} holding the descriptor's fragment
 * skills, referenced at position 1, and one fragment {@code <prompt>-ref-<skill id>} per reference
 * skill, referenced at position 100 + i. Skills keep the index of their entry in the descriptor
 * list, so an entry that cannot be resolved leaves a gap instead of shifting later skills.
 */
public class FragmentLinker {

    private static final Logger logger = LoggerFactory.getLogger(FragmentLinker.class);

    /**
     * Outcome of linking one descriptor.
     */
    public record LinkResult(String promptName, int embeddedSkills, int referenceSkills, List<String> warnings) {

        public boolean linked() {
            return embeddedSkills + referenceSkills > 0;
        }
    }

    private record ResolvedSkill(int index, SkillRecord skill) {
    }

    private final SkillsDatabase database;
    private final SkillRepository skillRepository;
    private final PromptRepository promptRepository;
    private final FragmentRepository fragmentRepository;
    private final Path projectRoot;

    public FragmentLinker(final SkillsDatabase database, final SkillRepository skillRepository,
                          final PromptRepository promptRepository, final FragmentRepository fragmentRepository,
                          final Path projectRoot) {
        this.database = database;
        this.skillRepository = skillRepository;
        this.promptRepository = promptRepository;
        this.fragmentRepository = fragmentRepository;
        this.projectRoot = projectRoot;
    }

    /**
     * Replace all fragment associations of the descriptor's prompt in one transaction.
     */
    public LinkResult link(final PromptDescriptor descriptor) throws SQLException {
        final List<String> warnings = new ArrayList<>();

        final Optional<PromptRecord> prompt = promptRepository.findByName(descriptor.name());
        if (prompt.isEmpty()) {
            final String warning = "Prompt not found in database: " + descriptor.name();
            logger.warn(warning);
            warnings.add(warning);
            return new LinkResult(descriptor.name(), 0, 0, warnings);
        }

        final List<ResolvedSkill> embedded = resolveSkills(descriptor.fragments(), descriptor, warnings);
        final List<ResolvedSkill> references = resolveSkills(descriptor.references(), descriptor, warnings);
        final long promptId = prompt.get().id();

        database.inTransaction(conn -> {
            linkEmbedded(conn, descriptor, promptId, embedded);
            linkReferences(conn, descriptor, promptId, references);
            return null;
        });

        logger.info("Linked prompt {}: {} embedded skill(s), {} reference(s)",
                descriptor.name(), embedded.size(), references.size());
        return new LinkResult(descriptor.name(), embedded.size(), references.size(), warnings);
    }

    private void linkEmbedded(final Connection conn, final PromptDescriptor descriptor, final long promptId,
                              final List<ResolvedSkill> skills) throws SQLException {
        fragmentRepository.deleteReferences(conn, promptId, ReferenceKind.EMBEDDED);

        final String displayName = descriptor.title() != null ? descriptor.title() : descriptor.name();
        final long fragmentId = fragmentRepository.findOrCreate(conn,
                descriptor.name() + "-embedded",
                displayName + " Embedded Skills",
                "Embedded skills for " + descriptor.name() + " prompt");

        fragmentRepository.clearSkills(conn, fragmentId);
        for (final ResolvedSkill resolved : skills) {
            fragmentRepository.addSkill(conn, fragmentId, resolved.skill().id(), resolved.index());
        }
        fragmentRepository.addReference(conn, promptId, fragmentId, ReferenceKind.EMBEDDED,
                FragmentRepository.EMBEDDED_POSITION);
    }

    private void linkReferences(final Connection conn, final PromptDescriptor descriptor, final long promptId,
                                final List<ResolvedSkill> skills) throws SQLException {
        fragmentRepository.deleteReferences(conn, promptId, ReferenceKind.REFERENCE);

        for (final ResolvedSkill resolved : skills) {
            final SkillRecord skill = resolved.skill();
            final long fragmentId = fragmentRepository.findOrCreate(conn,
                    descriptor.name() + "-ref-" + skill.id(),
                    "Reference: " + skill.category() + "/" + skill.name(),
                    "Reference skill for " + descriptor.name() + " prompt");

            fragmentRepository.clearSkills(conn, fragmentId);
            fragmentRepository.addSkill(conn, fragmentId, skill.id(), 0);
            fragmentRepository.addReference(conn, promptId, fragmentId, ReferenceKind.REFERENCE,
                    FragmentRepository.REFERENCE_POSITION_OFFSET + resolved.index());
        }
    }

    private List<ResolvedSkill> resolveSkills(final List<String> relativePaths, final PromptDescriptor descriptor,
                                              final List<String> warnings) throws SQLException {
        final List<ResolvedSkill> skills = new ArrayList<>();
        for (int i = 0; i < relativePaths.size(); i++) {
            final String relativePath = relativePaths.get(i);
            final Path absolute = projectRoot.resolve(relativePath).toAbsolutePath().normalize();
            final Optional<SkillRecord> skill = skillRepository.findByPath(absolute.toString());
            if (skill.isPresent()) {
                skills.add(new ResolvedSkill(i, skill.get()));
            } else {
                final String warning = "Skill not found for prompt " + descriptor.name() + ": " + relativePath;
                logger.warn(warning);
                warnings.add(warning);
            }
        }
        return skills;
    }
}
