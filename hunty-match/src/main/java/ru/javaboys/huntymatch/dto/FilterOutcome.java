package ru.javaboys.huntymatch.dto;

import java.util.List;

/**
 * Result of the appropriateness pass. {@code failedOpen} is set when the
 * reasoning service was unusable and {@code kept} is just the unfiltered head.
 */
public record FilterOutcome(List<MatchResult> kept, List<RejectedMatch> rejected, boolean failedOpen) {

    public static FilterOutcome unfiltered(List<MatchResult> candidates, int topK, boolean failedOpen) {
        List<MatchResult> head = candidates.subList(0, Math.min(Math.max(topK, 0), candidates.size()));
        return new FilterOutcome(List.copyOf(head), List.of(), failedOpen);
    }
}
