package ru.javaboys.huntymatch.dto;

public enum MatchingPathEnum {
    VECTOR,
    FALLBACK
}
