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
 * Job posting. Everything except the embedding is fixed at construction;
 * the embedding is attached later by the vectorization run.
 */
@Getter
@ToString(exclude = {"description", "requirements", "embedding"})
public class Job {

    private final long id;
    private final String title;
    private final String company;
    private final String location;
    private final String industry;
    private final ExperienceLevelEnum experienceLevel;
    private final WorkTypeEnum workType;
    private final List<String> skills;
    @Nullable
    private final Integer salaryMin;
    @Nullable
    private final Integer salaryMax;
    private final String description;
    private final String requirements;
    private final String postedDate;

    @Nullable
    private volatile float[] embedding;

    @Builder(toBuilder = true)
    public Job(long id,
               String title,
               String company,
               String location,
               String industry,
               ExperienceLevelEnum experienceLevel,
               @Nullable WorkTypeEnum workType,
               @Nullable List<String> skills,
               @Nullable Integer salaryMin,
               @Nullable Integer salaryMax,
               @Nullable String description,
               @Nullable String requirements,
               @Nullable String postedDate,
               @Nullable float[] embedding) {
        require(title, "title", id);
        require(company, "company", id);
        require(location, "location", id);
        require(industry, "industry", id);
        if (experienceLevel == null) {
            throw new InvalidInputException("Job " + id + ": experienceLevel is required");
        }
        if (salaryMin != null && salaryMax != null && salaryMin > salaryMax) {
            throw new InvalidInputException("Job " + id + ": salaryMin " + salaryMin + " > salaryMax " + salaryMax);
        }
        this.id = id;
        this.title = title.trim();
        this.company = company.trim();
        this.location = location.trim();
        this.industry = industry.trim();
        this.experienceLevel = experienceLevel;
        this.workType = workType == null ? WorkTypeEnum.FULL_TIME : workType;
        this.skills = skills == null ? List.of() : skills.stream().filter(Objects::nonNull).toList();
        this.salaryMin = salaryMin;
        this.salaryMax = salaryMax;
        this.description = StringUtils.defaultString(description);
        this.requirements = StringUtils.defaultString(requirements);
        this.postedDate = StringUtils.defaultString(postedDate);
        this.embedding = embedding;
    }

    public void attachEmbedding(float[] embedding) {
        if (embedding == null || embedding.length == 0) {
            throw new InvalidInputException("Job " + id + ": embedding must not be empty");
        }
        this.embedding = embedding;
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    private static void require(String value, String field, long id) {
        if (StringUtils.isBlank(value)) {
            throw new InvalidInputException("Job " + id + ": " + field + " is required");
        }
    }
}
