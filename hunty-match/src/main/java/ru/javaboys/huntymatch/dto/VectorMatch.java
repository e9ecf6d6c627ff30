package ru.javaboys.huntymatch.dto;

import java.util.Map;

/**
 * One nearest-neighbour hit as returned by the vector index.
 */
public record VectorMatch(String id, double score, Map<String, Object> metadata) {
}
