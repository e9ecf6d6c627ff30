package ru.javaboys.huntymatch.scoring;

import lombok.Builder;
import lombok.Value;

/**
 * Weights and confidence thresholds of the composite score. Built once at startup.
 */
@Value
@Builder(toBuilder = true)
public class ScoringConfig {

    // with a vector signal
    @Builder.Default
    double vectorWeight = 0.5;
    @Builder.Default
    double skillWeight = 0.3;
    @Builder.Default
    double experienceWeight = 0.2;

    // without one
    @Builder.Default
    double fallbackSkillWeight = 0.7;
    @Builder.Default
    double fallbackExperienceWeight = 0.3;

    @Builder.Default
    double highScoreThreshold = 0.75;
    @Builder.Default
    int highMinSkills = 2;
    @Builder.Default
    double mediumScoreThreshold = 0.55;
    @Builder.Default
    int mediumMinSkills = 1;

    @Builder.Default
    double fallbackHighOverlap = 0.6;
    @Builder.Default
    int fallbackHighMinSkills = 3;
    @Builder.Default
    double fallbackMediumOverlap = 0.3;
    @Builder.Default
    int fallbackMediumMinSkills = 2;

    public static ScoringConfig defaults() {
        return ScoringConfig.builder().build();
    }
}
