package ru.javaboys.huntymatch.scoring;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SkillOverlapScorerTest {

    @Test
    void countsJobSkillsCoveredByResume() {
        SkillOverlap overlap = SkillOverlapScorer.overlap(
                List.of("react", "typescript", "node.js"),
                List.of("react", "node.js", "aws"));

        assertThat(overlap.matchingSkills()).containsExactly("react", "node.js");
        assertThat(overlap.score()).isCloseTo(2.0 / 3, within(1e-9));
    }

    @Test
    void containmentWorksInBothDirections() {
        // "java" covers "javascript" and "spring boot" covers "spring"
        SkillOverlap overlap = SkillOverlapScorer.overlap(
                List.of("JavaScript", "Spring", "Kubernetes"),
                List.of("java", "spring boot"));

        assertThat(overlap.matchingSkills()).containsExactly("JavaScript", "Spring");
        assertThat(overlap.count()).isEqualTo(2);
    }

    @Test
    void keepsJobSpellingAndIgnoresCaseAndWhitespace() {
        SkillOverlap overlap = SkillOverlapScorer.overlap(
                List.of("  PostgreSQL ", "Docker"),
                List.of("postgresql", " DOCKER"));

        assertThat(overlap.matchingSkills()).containsExactly("PostgreSQL", "Docker");
        assertThat(overlap.score()).isEqualTo(1.0);
    }

    @Test
    void duplicateJobSkillsCountOnce() {
        SkillOverlap overlap = SkillOverlapScorer.overlap(
                List.of("Python", "python", "SQL"),
                List.of("python"));

        assertThat(overlap.matchingSkills()).containsExactly("Python");
        assertThat(overlap.score()).isEqualTo(0.5);
    }

    @Test
    void emptyJobSkillsScoreZero() {
        SkillOverlap overlap = SkillOverlapScorer.overlap(List.of(), List.of("go"));

        assertThat(overlap.matchingSkills()).isEmpty();
        assertThat(overlap.score()).isZero();
    }

    @Test
    void blankAndNullSkillsAreIgnored() {
        SkillOverlap overlap = SkillOverlapScorer.overlap(
                Arrays.asList("go", " ", null),
                Arrays.asList("", null, "golang"));

        assertThat(overlap.matchingSkills()).containsExactly("go");
        assertThat(overlap.score()).isEqualTo(1.0);
    }
}
