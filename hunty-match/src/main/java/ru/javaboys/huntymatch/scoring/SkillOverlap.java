package ru.javaboys.huntymatch.scoring;

import java.util.List;

/**
 * @param matchingSkills job skills (original spelling, job order) that some résumé skill covers
 * @param score          matched / max(jobSkills, 1)
 */
public record SkillOverlap(List<String> matchingSkills, double score) {

    public int count() {
        return matchingSkills.size();
    }
}
