package ru.javaboys.huntymatch.scoring;

import org.junit.jupiter.api.Test;
import ru.javaboys.huntymatch.entity.ExperienceLevelEnum;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static ru.javaboys.huntymatch.entity.ExperienceLevelEnum.ENTRY;
import static ru.javaboys.huntymatch.entity.ExperienceLevelEnum.LEADERSHIP;
import static ru.javaboys.huntymatch.entity.ExperienceLevelEnum.MID;
import static ru.javaboys.huntymatch.entity.ExperienceLevelEnum.SENIOR;

class ExperienceAlignmentScorerTest {

    @Test
    void sameTierIsFullyAligned() {
        for (ExperienceLevelEnum level : ExperienceLevelEnum.values()) {
            assertThat(ExperienceAlignmentScorer.alignment(level, level)).isEqualTo(1.0);
        }
    }

    @Test
    void distanceIsSymmetric() {
        assertThat(ExperienceAlignmentScorer.alignment(LEADERSHIP, MID))
                .isEqualTo(ExperienceAlignmentScorer.alignment(MID, LEADERSHIP))
                .isCloseTo(1.0 / 3, within(1e-9));
        assertThat(ExperienceAlignmentScorer.alignment(SENIOR, MID)).isCloseTo(2.0 / 3, within(1e-9));
    }

    @Test
    void oppositeEndsScoreZero() {
        assertThat(ExperienceAlignmentScorer.alignment(ENTRY, LEADERSHIP)).isZero();
    }

    @Test
    void unknownTierCountsAsEntry() {
        assertThat(ExperienceAlignmentScorer.alignment(null, ENTRY)).isEqualTo(1.0);
        assertThat(ExperienceAlignmentScorer.alignment(SENIOR, null)).isCloseTo(1.0 / 3, within(1e-9));
    }
}
