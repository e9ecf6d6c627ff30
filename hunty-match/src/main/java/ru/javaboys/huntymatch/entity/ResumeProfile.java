package ru.javaboys.huntymatch.entity;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;
import org.springframework.lang.Nullable;
import ru.javaboys.huntymatch.exception.InvalidInputException;

import java.util.List;
import java.util.Objects;

/**
 * Parsed résumé data produced upstream (skills, role, industries, level).
 */
@Getter
@ToString
public class ResumeProfile {

    private final List<String> skills;
    private final String primaryRole;
    private final List<String> industries;
    private final ExperienceLevelEnum experienceLevel;
    private final double yearsOfExperience;

    @Builder
    public ResumeProfile(@Nullable List<String> skills,
                         @Nullable String primaryRole,
                         @Nullable List<String> industries,
                         @Nullable ExperienceLevelEnum experienceLevel,
                         double yearsOfExperience) {
        if (yearsOfExperience < 0 || Double.isNaN(yearsOfExperience)) {
            throw new InvalidInputException("yearsOfExperience must be non-negative: " + yearsOfExperience);
        }
        this.skills = skills == null ? List.of() : skills.stream().filter(Objects::nonNull).toList();
        this.primaryRole = StringUtils.defaultString(primaryRole).trim();
        this.industries = industries == null ? List.of() : industries.stream().filter(Objects::nonNull).toList();
        // unknown level counts as entry
        this.experienceLevel = experienceLevel == null ? ExperienceLevelEnum.ENTRY : experienceLevel;
        this.yearsOfExperience = yearsOfExperience;
    }
}
