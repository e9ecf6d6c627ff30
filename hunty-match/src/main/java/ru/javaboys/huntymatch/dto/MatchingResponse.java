package ru.javaboys.huntymatch.dto;

import java.util.List;

public record MatchingResponse(List<MatchResult> matches, MatchingStats stats) {
}
