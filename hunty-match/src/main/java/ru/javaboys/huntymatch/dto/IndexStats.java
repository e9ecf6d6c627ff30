package ru.javaboys.huntymatch.dto;

public record IndexStats(long count, int dimension) {

    public static IndexStats empty() {
        return new IndexStats(0, 0);
    }
}
