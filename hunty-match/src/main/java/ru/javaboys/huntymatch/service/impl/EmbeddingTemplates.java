package ru.javaboys.huntymatch.service.impl;

import org.apache.commons.lang3.StringUtils;
import ru.javaboys.huntymatch.entity.Job;
import ru.javaboys.huntymatch.entity.Resume;
import ru.javaboys.huntymatch.entity.ResumeProfile;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Texts that get embedded for jobs and résumés. Most important matching signals go first.
 */
public class EmbeddingTemplates {

    static final int RESUME_TEXT_LIMIT = 4000;
    static final int EMBEDDING_TEXT_LIMIT = 6000;
    static final int DESCRIPTION_LIMIT = 400;

    private static final List<String> DESCRIPTION_SECTIONS = List.of(
            "Key Responsibilities",
            "Responsibilities",
            "What you'll do",
            "Role Overview",
            "About the Role"
    );

    private EmbeddingTemplates() {
    }

    public static String jobText(Job job) {
        List<String> sections = new ArrayList<>();
        sections.add("Position: %s (%s)".formatted(job.getTitle(), job.getExperienceLevel().getId()));
        if (StringUtils.isNotBlank(job.getRequirements())) {
            sections.add("Requirements: " + job.getRequirements().trim());
        }
        if (!job.getSkills().isEmpty()) {
            sections.add("Skills: " + String.join(", ", job.getSkills()));
        }
        sections.add("Type: %s. Location: %s".formatted(job.getWorkType().getId(), job.getLocation()));
        sections.add("Company: %s. Industry: %s".formatted(job.getCompany(), job.getIndustry()));
        if (job.getSalaryMin() != null && job.getSalaryMax() != null) {
            sections.add(String.format(Locale.US, "Salary: $%,d - $%,d", job.getSalaryMin(), job.getSalaryMax()));
        }
        String description = keyDescription(job.getDescription());
        if (!description.isEmpty()) {
            sections.add("Description: " + description);
        }
        return String.join("\n\n", sections);
    }

    public static String resumeText(Resume resume) {
        ResumeProfile p = resume.getProfile();
        String profileText = profileText(p);
        String raw = resume.getOriginalText();
        String truncated = raw.length() > RESUME_TEXT_LIMIT ? raw.substring(0, RESUME_TEXT_LIMIT) + "..." : raw;
        String combined = (truncated + " " + profileText).trim();
        if (combined.length() > EMBEDDING_TEXT_LIMIT) {
            return (profileText + " " + p.getExperienceLevel().getId()).trim();
        }
        return combined;
    }

    static String keyDescription(String description) {
        if (StringUtils.isBlank(description)) {
            return "";
        }
        for (String keyword : DESCRIPTION_SECTIONS) {
            int at = description.indexOf(keyword);
            if (at >= 0) {
                String section = StringUtils.stripStart(description.substring(at + keyword.length()), ": \n");
                if (StringUtils.isNotBlank(section)) {
                    return StringUtils.left(section, DESCRIPTION_LIMIT).trim();
                }
            }
        }
        return StringUtils.left(description, DESCRIPTION_LIMIT).trim();
    }

    private static String profileText(ResumeProfile p) {
        return String.join(" ", String.join(" ", p.getSkills()), p.getPrimaryRole(), String.join(" ", p.getIndustries()))
                .replaceAll("\\s+", " ")
                .trim();
    }
}
