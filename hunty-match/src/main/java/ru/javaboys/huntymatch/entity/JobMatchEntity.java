package ru.javaboys.huntymatch.entity;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Audit record of one (résumé, job) match returned to a caller. Never updated.
 */
@Value
@Builder(toBuilder = true)
public class JobMatchEntity {
    Long id;
    long resumeId;
    long jobId;
    double matchScore;
    List<String> matchingSkills;
    ConfidenceLevelEnum confidence;
    String explanation;
    LocalDateTime createdAt;
}
