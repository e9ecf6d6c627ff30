package ru.javaboys.huntymatch.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MatchingStats {
    long totalJobs;
    int matchesFound;
    String avgMatchScore;   // "77%" or "-"
    String processingTime;  // "0.4s"
    MatchingPathEnum path;
}
