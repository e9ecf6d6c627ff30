package ru.javaboys.huntymatch.service.impl;

import org.junit.jupiter.api.Test;
import ru.javaboys.huntymatch.dto.MatchResult;
import ru.javaboys.huntymatch.entity.ConfidenceLevelEnum;
import ru.javaboys.huntymatch.entity.Job;
import ru.javaboys.huntymatch.exception.InvalidInputException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static ru.javaboys.huntymatch.support.TestData.job;

class MmrDiversifierTest {

    private final MmrDiversifier diversifier = new MmrDiversifier();

    private static MatchResult match(Job job, double score) {
        return MatchResult.builder()
                .job(job)
                .matchScore(score)
                .matchingSkills(List.of())
                .confidence(ConfidenceLevelEnum.MEDIUM)
                .explanation("")
                .build();
    }

    @Test
    void singleCompanyPoolIsUsedAsLastResort() {
        List<MatchResult> ranked = new ArrayList<>();
        double[] scores = {0.9, 0.85, 0.8, 0.75, 0.7};
        for (int i = 0; i < scores.length; i++) {
            ranked.add(match(job(i + 1, "Acme Corp", "NYC", "Tech"), scores[i]));
        }

        List<MatchResult> picked = diversifier.diversify(ranked, 0.7, 3);

        assertThat(picked).extracting(MatchResult::getMatchScore).containsExactly(0.9, 0.85, 0.8);
        assertThat(picked).allMatch(m -> m.getJob().getCompany().equals("Acme Corp"));
    }

    @Test
    void prefersOtherCompaniesOverRepeats() {
        List<MatchResult> ranked = List.of(
                match(job(1, "Acme", "NYC", "Tech"), 0.90),
                match(job(2, "acme ", "Boston", "Tech"), 0.88),
                match(job(3, "Globex", "Austin", "Finance"), 0.70));

        List<MatchResult> picked = diversifier.diversify(ranked, 0.7, 2);

        // second Acme: 0.7*0.88 + 0.3*0.3 = 0.706, Globex: 0.7*0.70 + 0.3*1.0 = 0.79
        assertThat(picked).extracting(m -> m.getJob().getId()).containsExactly(1L, 3L);
    }

    @Test
    void neverExceedsMaxResultsAndNeverDuplicates() {
        Job shared = job(7, "Initech", "LA", "Tech");
        List<MatchResult> ranked = List.of(
                match(shared, 0.9),
                match(shared, 0.9),
                match(job(8, "Hooli", "SF", "Tech"), 0.8),
                match(job(9, "Umbrella", "NYC", "Health"), 0.6),
                match(job(10, "Wayne", "Gotham", "Tech"), 0.5));

        for (int max = 0; max <= 6; max++) {
            List<MatchResult> picked = diversifier.diversify(ranked, 0.5, max);
            assertThat(picked).hasSizeLessThanOrEqualTo(max);
            assertThat(picked).extracting(m -> m.getJob().getId()).doesNotHaveDuplicates();
        }
    }

    @Test
    void lambdaOneKeepsRelevanceOrder() {
        List<MatchResult> ranked = List.of(
                match(job(1, "A", "L1", "I1"), 0.95),
                match(job(2, "B", "L2", "I2"), 0.80),
                match(job(3, "C", "L3", "I3"), 0.60),
                match(job(4, "D", "L4", "I4"), 0.40));

        List<MatchResult> picked = diversifier.diversify(ranked, 1.0, 3);

        assertThat(picked).extracting(m -> m.getJob().getId()).containsExactly(1L, 2L, 3L);
    }

    @Test
    void smallPoolIsReturnedAsIs() {
        List<MatchResult> ranked = List.of(
                match(job(1, "A", "L", "I"), 0.5),
                match(job(2, "A", "L", "I"), 0.9));

        assertThat(diversifier.diversify(ranked, 0.7, 5)).containsExactlyElementsOf(ranked);
    }

    @Test
    void firstPickIsHighestScoreEvenIfNotFirst() {
        List<MatchResult> ranked = List.of(
                match(job(1, "A", "L1", "I1"), 0.5),
                match(job(2, "B", "L2", "I2"), 0.9),
                match(job(3, "C", "L3", "I3"), 0.4));

        assertThat(diversifier.diversify(ranked, 0.7, 1))
                .extracting(m -> m.getJob().getId()).containsExactly(2L);
    }

    @Test
    void diversityPenalties() {
        Job candidate = job(1, "Acme", "NYC", "Tech");

        assertThat(MmrDiversifier.diversity(candidate, Map.of(), Map.of(), Map.of())).isEqualTo(1.0);
        assertThat(MmrDiversifier.diversity(candidate, Map.of("acme", 2), Map.of(), Map.of()))
                .isCloseTo(0.09, within(1e-9));
        assertThat(MmrDiversifier.diversity(candidate, Map.of(), Map.of("nyc", 2), Map.of("tech", 3)))
                .isEqualTo(1.0);
        assertThat(MmrDiversifier.diversity(candidate, Map.of(), Map.of("nyc", 3), Map.of("tech", 4)))
                .isCloseTo(0.8 * 0.9, within(1e-9));
    }

    @Test
    void rejectsBadArguments() {
        List<MatchResult> ranked = List.of(match(job(1, "A", "L", "I"), 0.5));

        assertThatThrownBy(() -> diversifier.diversify(ranked, 1.5, 1)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> diversifier.diversify(ranked, -0.1, 1)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> diversifier.diversify(ranked, 0.7, -1)).isInstanceOf(InvalidInputException.class);
    }
}
