package de.mirkosertic.skills.search;

import de.mirkosertic.skills.db.FragmentRepository.FragmentSkill;
import de.mirkosertic.skills.db.PromptRecord;

import java.util.List;

/**
 * A prompt together with the skills it embeds and the skills it only references.
 */
public record PromptDetails(
        PromptRecord prompt,
        List<FragmentSkill> embeddedSkills,
        List<FragmentSkill> referenceSkills
) {
}
