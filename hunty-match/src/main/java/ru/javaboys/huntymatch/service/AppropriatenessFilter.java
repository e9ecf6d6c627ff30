package ru.javaboys.huntymatch.service;

import ru.javaboys.huntymatch.dto.FilterOutcome;
import ru.javaboys.huntymatch.dto.MatchResult;
import ru.javaboys.huntymatch.entity.ResumeProfile;

import java.util.List;

/**
 * Drops matches that are inappropriate for the candidate (seniority or domain mismatch)
 * and may move the confidence of kept ones by one tier.
 */
public interface AppropriatenessFilter {

    FilterOutcome filter(ResumeProfile profile, List<MatchResult> candidates, int topK);
}
