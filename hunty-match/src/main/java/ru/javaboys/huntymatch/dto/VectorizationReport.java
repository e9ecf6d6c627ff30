package ru.javaboys.huntymatch.dto;

public record VectorizationReport(int processed, int succeeded, int failed, int upserted) {
}
