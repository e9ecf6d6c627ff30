package ru.javaboys.huntymatch.scoring;

import org.springframework.lang.Nullable;
import ru.javaboys.huntymatch.entity.ExperienceLevelEnum;

public final class ExperienceAlignmentScorer {

    private static final int MAX_DISTANCE = ExperienceLevelEnum.values().length - 1;

    private ExperienceAlignmentScorer() {
    }

    /**
     * 1 for the same tier, 0 for opposite ends. Missing tiers count as ENTRY.
     */
    public static double alignment(@Nullable ExperienceLevelEnum job, @Nullable ExperienceLevelEnum resume) {
        int j = ordinal(job);
        int r = ordinal(resume);
        return 1.0 - (double) Math.abs(j - r) / MAX_DISTANCE;
    }

    private static int ordinal(@Nullable ExperienceLevelEnum level) {
        return level == null ? ExperienceLevelEnum.ENTRY.ordinal() : level.ordinal();
    }
}
