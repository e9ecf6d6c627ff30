package ru.javaboys.huntymatch.service.impl;

import ru.javaboys.huntymatch.dto.FilterOutcome;
import ru.javaboys.huntymatch.dto.MatchResult;
import ru.javaboys.huntymatch.entity.ResumeProfile;
import ru.javaboys.huntymatch.service.AppropriatenessFilter;

import java.util.List;

/**
 * Deterministic filter: keeps the first {@code topK} candidates as they are.
 */
public class KeepAllAppropriatenessFilter implements AppropriatenessFilter {

    @Override
    public FilterOutcome filter(ResumeProfile profile, List<MatchResult> candidates, int topK) {
        return FilterOutcome.unfiltered(candidates == null ? List.of() : candidates, topK, false);
    }
}
