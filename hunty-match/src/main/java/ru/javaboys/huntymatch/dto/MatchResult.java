package ru.javaboys.huntymatch.dto;

import lombok.Builder;
import lombok.Value;
import ru.javaboys.huntymatch.entity.ConfidenceLevelEnum;
import ru.javaboys.huntymatch.entity.Job;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class MatchResult {
    Job job;
    double matchScore;             // 0..1, two decimals
    List<String> matchingSkills;   // job spelling
    ConfidenceLevelEnum confidence;
    String explanation;
    double vectorScore;            // 0 when no vector signal was available

    public MatchResult withConfidence(ConfidenceLevelEnum newConfidence) {
        return toBuilder().confidence(newConfidence).build();
    }
}
