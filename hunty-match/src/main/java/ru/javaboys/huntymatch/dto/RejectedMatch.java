package ru.javaboys.huntymatch.dto;

public record RejectedMatch(MatchResult match, String reason) {
}
